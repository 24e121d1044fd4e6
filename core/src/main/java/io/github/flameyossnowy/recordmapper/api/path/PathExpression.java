package io.github.flameyossnowy.recordmapper.api.path;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered chain of field accesses by logical (declared) name, such as {@code address -> zipCode}.
 * <p>
 * Optional unwrapping is implicit: {@code user.address.zipCode} walks into an
 * {@code Optional<Address>} without an explicit step. When parsing, a literal {@code ?}
 * segment ({@code address.?.zipCode}) is accepted as an optional-hop marker and dropped.
 */
public record PathExpression(@NotNull List<String> hops) {
    public static final String OPTIONAL_HOP = "?";

    public PathExpression {
        hops = List.copyOf(hops);
        for (String hop : hops) {
            if (hop.isBlank()) {
                throw new IllegalArgumentException("Path hop must not be blank: " + hops);
            }
        }
    }

    @Contract("_ -> new")
    public static @NotNull PathExpression of(String @NotNull ... hops) {
        return new PathExpression(List.of(hops));
    }

    /**
     * Parses a dot separated chain of logical names, eliding {@code ?} markers.
     */
    @Contract("_ -> new")
    public static @NotNull PathExpression parse(@NotNull String path) {
        if (path.isEmpty()) {
            return new PathExpression(List.of());
        }

        List<String> hops = new ArrayList<>();
        for (String segment : path.split("\\.", -1)) {
            String hop = segment.trim();
            if (hop.equals(OPTIONAL_HOP)) {
                continue;
            }
            hops.add(hop);
        }
        return new PathExpression(hops);
    }

    public boolean isEmpty() {
        return hops.isEmpty();
    }

    public int size() {
        return hops.size();
    }

    @Contract("_ -> new")
    public @NotNull PathExpression then(@NotNull String hop) {
        List<String> next = new ArrayList<>(hops.size() + 1);
        next.addAll(hops);
        next.add(hop);
        return new PathExpression(next);
    }

    @Override
    public String toString() {
        return String.join(".", hops);
    }
}
