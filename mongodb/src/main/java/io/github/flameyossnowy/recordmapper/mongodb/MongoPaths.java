package io.github.flameyossnowy.recordmapper.mongodb;

import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import io.github.flameyossnowy.recordmapper.api.RecordMapper;
import io.github.flameyossnowy.recordmapper.api.path.PathExpression;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds driver filters, updates, projections and sorts from logical field paths.
 * <p>
 * Paths are written with declared names ({@code "address.zipCode"}, optionally
 * {@code "address.?.zipCode"}) and turned into document paths through the mapper,
 * so renames never leak into query code:
 * <pre>{@code
 * Bson filter = paths.eq(User.class, "address.zipCode", 10001);   // {"address.zip": 10001}
 * }</pre>
 * Enum values should be passed as their names, matching how {@code RecordCodec} stores them.
 */
public final class MongoPaths {
    private final RecordMapper mapper;

    public MongoPaths(@NotNull RecordMapper mapper) {
        this.mapper = mapper;
    }

    public @NotNull String path(@NotNull Class<?> type, @NotNull String logicalPath) {
        return mapper.resolvePath(type, PathExpression.parse(logicalPath));
    }

    public @NotNull String path(@NotNull Class<?> type, @NotNull PathExpression expression) {
        return mapper.resolvePath(type, expression);
    }

    public @NotNull Bson eq(@NotNull Class<?> type, @NotNull String logicalPath, Object value) {
        return Filters.eq(path(type, logicalPath), value);
    }

    public @NotNull Bson ne(@NotNull Class<?> type, @NotNull String logicalPath, Object value) {
        return Filters.ne(path(type, logicalPath), value);
    }

    public @NotNull Bson gt(@NotNull Class<?> type, @NotNull String logicalPath, @NotNull Object value) {
        return Filters.gt(path(type, logicalPath), value);
    }

    public @NotNull Bson gte(@NotNull Class<?> type, @NotNull String logicalPath, @NotNull Object value) {
        return Filters.gte(path(type, logicalPath), value);
    }

    public @NotNull Bson lt(@NotNull Class<?> type, @NotNull String logicalPath, @NotNull Object value) {
        return Filters.lt(path(type, logicalPath), value);
    }

    public @NotNull Bson lte(@NotNull Class<?> type, @NotNull String logicalPath, @NotNull Object value) {
        return Filters.lte(path(type, logicalPath), value);
    }

    public @NotNull Bson in(@NotNull Class<?> type, @NotNull String logicalPath, @NotNull Iterable<?> values) {
        return Filters.in(path(type, logicalPath), values);
    }

    public @NotNull Bson exists(@NotNull Class<?> type, @NotNull String logicalPath, boolean exists) {
        return Filters.exists(path(type, logicalPath), exists);
    }

    public @NotNull Bson set(@NotNull Class<?> type, @NotNull String logicalPath, Object value) {
        return Updates.set(path(type, logicalPath), value);
    }

    public @NotNull Bson unset(@NotNull Class<?> type, @NotNull String logicalPath) {
        return Updates.unset(path(type, logicalPath));
    }

    public @NotNull Bson inc(@NotNull Class<?> type, @NotNull String logicalPath, @NotNull Number amount) {
        return Updates.inc(path(type, logicalPath), amount);
    }

    public @NotNull Bson include(@NotNull Class<?> type, String @NotNull ... logicalPaths) {
        return Projections.include(paths(type, logicalPaths));
    }

    public @NotNull Bson exclude(@NotNull Class<?> type, String @NotNull ... logicalPaths) {
        return Projections.exclude(paths(type, logicalPaths));
    }

    public @NotNull Bson ascending(@NotNull Class<?> type, String @NotNull ... logicalPaths) {
        return Sorts.ascending(paths(type, logicalPaths));
    }

    public @NotNull Bson descending(@NotNull Class<?> type, String @NotNull ... logicalPaths) {
        return Sorts.descending(paths(type, logicalPaths));
    }

    private List<String> paths(Class<?> type, String[] logicalPaths) {
        List<String> resolved = new ArrayList<>(logicalPaths.length);
        for (String logicalPath : logicalPaths) {
            resolved.add(path(type, logicalPath));
        }
        return resolved;
    }
}
