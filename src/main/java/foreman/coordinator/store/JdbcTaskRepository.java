package foreman.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import foreman.coordinator.exception.TaskNotFoundException;
import foreman.coordinator.model.Priority;
import foreman.coordinator.model.Task;
import foreman.coordinator.model.TaskSnapshot;
import foreman.coordinator.model.TaskStatus;
import foreman.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * JDBC implementation of the task store, keeping a durable audit trail of every task.
 * Methods are synchronized: the scheduler is the single writer, and validation of the
 * dependency graph must see the same rows the write commits against.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String COLUMNS = "id, seq, title, instruction, target_paths, branch, priority, status, "
            + "attempts, max_attempts, assigned_to, last_error, result, created_at, updated_at";

    private final Database db;
    private final Clock clock;

    public JdbcTaskRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcTaskRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public synchronized void upsert(Task task) {
        upsertAll(List.of(task));
    }

    @Override
    public synchronized void upsertAll(List<Task> batch) {
        if (batch.isEmpty())
            return;

        try (Connection conn = db.getConnection()) {
            try {
                Map<String, Task> current = loadAll(conn);
                Map<String, Set<String>> edges = new LinkedHashMap<>();
                current.forEach((id, t) -> edges.put(id, t.dependencies()));

                TaskGraph.validate(edges, batch);
                for (Task incoming : batch) {
                    Task existing = current.get(incoming.id());
                    if (existing != null) {
                        TaskTransitions.checkReplaceable(existing, incoming);
                    }
                }

                Instant now = clock.instant();
                long sequence = nextSequence(conn);
                for (Task incoming : batch) {
                    Task existing = current.get(incoming.id());
                    if (existing == null) {
                        Task created = TaskTransitions.created(incoming, sequence++, now);
                        insert(conn, created);
                        current.put(created.id(), created);
                    } else {
                        Task merged = TaskTransitions.merged(existing, incoming, now);
                        update(conn, merged);
                        current.put(merged.id(), merged);
                    }
                    replaceDependencies(conn, incoming);
                }
                conn.commit();
                log.debug("Upserted {} tasks", batch.size());
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to upsert tasks batch", e);
        }
    }

    @Override
    public synchronized Optional<Task> findById(String taskId) {
        try (Connection conn = db.getConnection()) {
            return load(conn, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public synchronized List<Task> findByStatus(TaskStatus... statuses) {
        Set<TaskStatus> filter = Arrays.stream(statuses).collect(Collectors.toSet());
        try (Connection conn = db.getConnection()) {
            List<Task> result = new ArrayList<>();
            for (Task task : loadAll(conn).values()) {
                if (filter.isEmpty() || filter.contains(task.status())) {
                    result.add(task);
                }
            }
            return result;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks by status", e);
        }
    }

    @Override
    public synchronized Task transition(String taskId, TaskStatus next) {
        return updateInTx(taskId, t -> TaskTransitions.moved(t, next, clock.instant()));
    }

    @Override
    public synchronized Task markInProgress(String taskId, String workerId) {
        return updateInTx(taskId, t -> TaskTransitions.inProgress(t, workerId, clock.instant()));
    }

    @Override
    public synchronized Task markCompleted(String taskId, String detail) {
        return updateInTx(taskId, t -> TaskTransitions.completed(t, detail, clock.instant()));
    }

    @Override
    public synchronized Task markFailed(String taskId, String reason) {
        return updateInTx(taskId, t -> TaskTransitions.failed(t, reason, clock.instant()));
    }

    @Override
    public synchronized int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks by status: " + status, e);
        }
    }

    @Override
    public synchronized TaskSnapshot snapshot() {
        try (Connection conn = db.getConnection()) {
            return new TaskSnapshot(loadAll(conn).values());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load task snapshot", e);
        }
    }

    // ==================== Helpers ====================

    private Task updateInTx(String taskId, UnaryOperator<Task> change) {
        try (Connection conn = db.getConnection()) {
            try {
                Task current = load(conn, taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
                Task updated = change.apply(current);
                update(conn, updated);
                conn.commit();
                log.debug("Task {}: {} -> {}", taskId, current.status(), updated.status());
                return updated;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update task: " + taskId, e);
        }
    }

    private Optional<Task> load(Connection conn, String taskId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM tasks WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapRow(rs, loadDependencies(conn, taskId)));
            }
        }
    }

    private Map<String, Task> loadAll(Connection conn) throws SQLException {
        Map<String, List<String>> deps = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT task_id, depends_on FROM task_dependencies ORDER BY task_id, position");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                deps.computeIfAbsent(rs.getString("task_id"), k -> new ArrayList<>())
                        .add(rs.getString("depends_on"));
            }
        }

        Map<String, Task> tasks = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM tasks ORDER BY seq");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String id = rs.getString("id");
                tasks.put(id, mapRow(rs, deps.getOrDefault(id, List.of())));
            }
        }
        return tasks;
    }

    private List<String> loadDependencies(Connection conn, String taskId) throws SQLException {
        String sql = "SELECT depends_on FROM task_dependencies WHERE task_id = ? ORDER BY position";
        List<String> deps = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    deps.add(rs.getString(1));
                }
            }
        }
        return deps;
    }

    private long nextSequence(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(seq), 0) FROM tasks");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) + 1 : 1;
        }
    }

    private void insert(Connection conn, Task task) throws SQLException {
        String sql = "INSERT INTO tasks (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, task.id());
            ps.setLong(2, task.sequence());
            ps.setString(3, task.title());
            ps.setString(4, task.instruction());
            ps.setString(5, toJson(task.targetPaths()));
            ps.setString(6, task.branch());
            ps.setString(7, task.priority().name());
            ps.setString(8, task.status().name());
            ps.setInt(9, task.attempts());
            ps.setInt(10, task.maxAttempts());
            ps.setString(11, task.assignedTo());
            ps.setString(12, task.lastError());
            ps.setString(13, task.result());
            setTimestamp(ps, 14, task.createdAt());
            setTimestamp(ps, 15, task.updatedAt());
            ps.executeUpdate();
        }
    }

    private void update(Connection conn, Task task) throws SQLException {
        String sql = """
                    UPDATE tasks
                    SET title = ?, instruction = ?, target_paths = ?, branch = ?, priority = ?, status = ?,
                        attempts = ?, max_attempts = ?, assigned_to = ?, last_error = ?, result = ?, updated_at = ?
                    WHERE id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, task.title());
            ps.setString(2, task.instruction());
            ps.setString(3, toJson(task.targetPaths()));
            ps.setString(4, task.branch());
            ps.setString(5, task.priority().name());
            ps.setString(6, task.status().name());
            ps.setInt(7, task.attempts());
            ps.setInt(8, task.maxAttempts());
            ps.setString(9, task.assignedTo());
            ps.setString(10, task.lastError());
            ps.setString(11, task.result());
            setTimestamp(ps, 12, task.updatedAt());
            ps.setString(13, task.id());
            ps.executeUpdate();
        }
    }

    private void replaceDependencies(Connection conn, Task task) throws SQLException {
        try (PreparedStatement delete = conn.prepareStatement("DELETE FROM task_dependencies WHERE task_id = ?")) {
            delete.setString(1, task.id());
            delete.executeUpdate();
        }
        if (task.dependencies().isEmpty()) {
            return;
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO task_dependencies (task_id, depends_on, position) VALUES (?, ?, ?)")) {
            int position = 0;
            for (String dep : task.dependencies()) {
                ps.setString(1, task.id());
                ps.setString(2, dep);
                ps.setInt(3, position++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private Task mapRow(ResultSet rs, List<String> dependencies) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .sequence(rs.getLong("seq"))
                .title(rs.getString("title"))
                .instruction(rs.getString("instruction"))
                .targetPaths(fromJson(rs.getString("target_paths")))
                .branch(rs.getString("branch"))
                .priority(Priority.valueOf(rs.getString("priority")))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .dependencies(new LinkedHashSet<>(dependencies))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .assignedTo(rs.getString("assigned_to"))
                .lastError(rs.getString("last_error"))
                .result(rs.getString("result"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }

    private static String toJson(List<String> paths) {
        try {
            return MAPPER.writeValueAsString(paths);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize target paths", e);
        }
    }

    private static List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt target_paths column: " + json, e);
        }
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, java.sql.Types.TIMESTAMP);
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }
}
