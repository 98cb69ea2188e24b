import io.github.flameyossnowy.linkage.api.AbstractRecord;
import io.github.flameyossnowy.linkage.api.Errors;
import io.github.flameyossnowy.linkage.api.Record;
import io.github.flameyossnowy.linkage.api.RepositoryRegistry;
import io.github.flameyossnowy.linkage.api.associations.CollectionProxy;
import io.github.flameyossnowy.linkage.api.associations.builder.Associations;
import io.github.flameyossnowy.linkage.api.exceptions.DeleteRestrictionException;
import io.github.flameyossnowy.linkage.api.exceptions.RecordNotSavedException;
import io.github.flameyossnowy.linkage.api.options.Query;
import io.github.flameyossnowy.linkage.memory.MemoryDatabase;
import io.github.flameyossnowy.linkage.memory.MemoryRepositoryAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependentTest {

    public static class Task extends AbstractRecord {
    }

    public static class Project extends AbstractRecord {
        static {
            Associations.hasMany(Project.class, "tasks", Map.of("dependent", "restrictWithException"));
        }

        public CollectionProxy<Task> tasks() {
            return collection("tasks");
        }
    }

    public static class Team extends AbstractRecord {
        static {
            Associations.hasMany(Team.class, "tasks", Map.of("dependent", "restrictWithError"));
        }

        public CollectionProxy<Task> tasks() {
            return collection("tasks");
        }
    }

    public static class Board extends AbstractRecord {
        static {
            Associations.hasMany(Board.class, "tasks", Map.of("dependent", "destroy"));
        }

        public CollectionProxy<Task> tasks() {
            return collection("tasks");
        }
    }

    public static class Sprint extends AbstractRecord {
        static {
            Associations.hasMany(Sprint.class, "tasks", Map.of("dependent", "deleteAll"));
        }

        public CollectionProxy<Task> tasks() {
            return collection("tasks");
        }
    }

    public static class Milestone extends AbstractRecord {
        static {
            Associations.hasMany(Milestone.class, "tasks");
        }

        public CollectionProxy<Task> tasks() {
            return collection("tasks");
        }
    }

    public static class League extends AbstractRecord {
        static {
            Associations.hasMany(League.class, "teams", Map.of("dependent", "destroy"));
        }

        public CollectionProxy<Team> teams() {
            return collection("teams");
        }
    }

    MemoryDatabase database;
    List<MemoryRepositoryAdapter<?, ?>> adapters;
    MemoryRepositoryAdapter<Task, Long> tasks;

    @BeforeEach
    void setup() {
        database = new MemoryDatabase();
        adapters = new ArrayList<>();
        tasks = register(Task.class);
        register(Project.class);
        register(Team.class);
        register(Board.class);
        register(Sprint.class);
        register(Milestone.class);
        register(League.class);
    }

    @AfterEach
    void teardown() {
        adapters.forEach(MemoryRepositoryAdapter::close);
        RepositoryRegistry.clear();
    }

    private <T extends Record> MemoryRepositoryAdapter<T, Long> register(Class<T> type) {
        MemoryRepositoryAdapter<T, Long> adapter = MemoryRepositoryAdapter.builder(type, Long.class).database(database).build();
        RepositoryRegistry.register(type.getSimpleName(), adapter);
        adapters.add(adapter);
        return adapter;
    }

    private static <T extends AbstractRecord> T saved(T record) {
        assertTrue(record.save());
        return record;
    }

    private long storedTasks() {
        return tasks.count(Query.select().build());
    }

    @Test
    void restrictWithExceptionKeepsTheOwner() {
        Project project = saved(new Project());
        project.tasks().create(Map.of("title", "write"));

        assertThrows(DeleteRestrictionException.class, project::destroy);

        assertFalse(project.isDestroyed());
        assertTrue(project.isPersisted());
        assertEquals(1, storedTasks());
        assertEquals(1, RepositoryRegistry.require(Project.class).count(Query.select().build()));
    }

    @Test
    void restrictWithExceptionAllowsAnEmptyOwner() {
        Project project = saved(new Project());

        assertTrue(project.destroy());
        assertTrue(project.isDestroyed());
    }

    @Test
    void restrictWithErrorAddsABaseError() {
        Team team = saved(new Team());
        team.tasks().create(Map.of("title", "write"));

        assertFalse(team.destroy());

        assertFalse(team.isDestroyed());
        assertEquals(List.of("Cannot delete record because dependent tasks exist"), team.getErrors().on(Errors.BASE));
        assertEquals(1, storedTasks());
    }

    @Test
    void destroyDestroysEveryMemberThenTheOwner() {
        Board board = saved(new Board());
        Task first = board.tasks().create(Map.of("title", "one"));
        Task second = board.tasks().create(Map.of("title", "two"));

        assertTrue(board.destroy());

        assertTrue(board.isDestroyed());
        assertTrue(first.isDestroyed());
        assertTrue(second.isDestroyed());
        assertEquals("tasks", first.getDestroyedByAssociation().name());
        assertEquals("tasks", second.getDestroyedByAssociation().name());
        assertEquals(0, storedTasks());
        assertEquals(0, RepositoryRegistry.require(Board.class).count(Query.select().build()));
    }

    @Test
    void deleteAllRemovesMembersWithoutLoadingThem() {
        Sprint sprint = saved(new Sprint());
        Task first = sprint.tasks().create(Map.of("title", "one"));
        sprint.tasks().create(Map.of("title", "two"));
        saved(new Task());

        assertTrue(sprint.destroy());

        assertEquals(1, storedTasks());
        assertFalse(first.isDestroyed());
        assertFalse(sprint.tasks().isLoaded());
    }

    @Test
    void withoutDependentMembersAreLeftAlone() {
        Milestone milestone = saved(new Milestone());
        Task task = milestone.tasks().create(Map.of("title", "one"));

        assertTrue(milestone.destroy());

        assertFalse(task.isDestroyed());
        assertEquals(1, storedTasks());
        assertEquals(milestone.getId(), tasks.findById((Long) task.getId()).readAttribute("milestoneId"));
    }

    @Test
    void removingFromADestroyingAssociationDestroysTheRecord() {
        Board board = saved(new Board());
        Task first = board.tasks().create(Map.of("title", "one"));
        board.tasks().create(Map.of("title", "two"));

        board.tasks().delete(first);

        assertTrue(first.isDestroyed());
        assertEquals(1, storedTasks());
        assertEquals(1, board.tasks().size());
    }

    @Test
    void removingFromADeletingAssociationDeletesInBulk() {
        Sprint sprint = saved(new Sprint());
        Task first = sprint.tasks().create(Map.of("title", "one"));

        sprint.tasks().delete(first);

        assertEquals(0, storedTasks());
        assertTrue(sprint.tasks().isEmpty());
    }

    @Test
    void clearFollowsTheRemovalPolicy() {
        Milestone milestone = saved(new Milestone());
        milestone.tasks().create(Map.of("title", "one"));
        Board board = saved(new Board());
        Task destroyed = board.tasks().create(Map.of("title", "two"));

        milestone.tasks().clear();
        board.tasks().clear();

        assertTrue(destroyed.isDestroyed());
        assertEquals(1, storedTasks());
        assertNull(tasks.find().get(0).readAttribute("milestoneId"));
    }

    @Test
    void destroyingAMemberThatRefusesLeavesTheCollectionAlone() {
        League league = saved(new League());
        Team team = league.teams().create(Map.of("name", "red"));
        team.tasks().create(Map.of("title", "write"));

        assertFalse(league.teams().destroy(team));

        assertFalse(team.isDestroyed());
        assertTrue(team.isPersisted());
        assertEquals(List.of("Cannot delete record because dependent tasks exist"), team.getErrors().on(Errors.BASE));
        assertEquals(1, league.teams().size());
        assertTrue(league.teams().contains(team));
        assertEquals(1, RepositoryRegistry.require(Team.class).count(Query.select().build()));
        assertFalse(database.inTransaction());
    }

    @Test
    void replacingAwayAMemberThatRefusesRestoresTheTarget() {
        League league = saved(new League());
        Team team = league.teams().create(Map.of("name", "red"));
        team.tasks().create(Map.of("title", "write"));

        assertThrows(RecordNotSavedException.class, () -> league.teams().replace(List.of()));

        assertFalse(team.isDestroyed());
        assertEquals(List.of(team), league.teams().loadTarget());
        assertEquals(1, RepositoryRegistry.require(Team.class).count(Query.select().build()));
        assertFalse(database.inTransaction());
    }
}
