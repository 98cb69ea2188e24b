package io.github.flameyossnowy.linkage.api.exceptions;

import io.github.flameyossnowy.linkage.api.Record;
import org.jetbrains.annotations.NotNull;

/**
 * Raised by the strict variants ({@code saveOrThrow}, {@code createOrThrow}) when validation fails.
 */
public class RecordInvalidException extends RecordNotSavedException {
    public RecordInvalidException(@NotNull Record record) {
        super("Validation failed: " + String.join(", ", record.getErrors().fullMessages()), record);
    }

    @Override
    public @NotNull Record getRecord() {
        return (Record) super.getRecord();
    }
}
