package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Hyperlink to either a bookmark inside the document ({@code anchor}) or an external location.
 */
public record Hyperlink(String anchor, String location, String tooltip, List<Run> runs) implements Inline {

    public Hyperlink {
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
        if ((anchor == null) == (location == null)) {
            throw new IllegalArgumentException("hyperlink needs exactly one of anchor or location");
        }
    }

    public static Hyperlink internal(String anchor, Run run) {
        return new Hyperlink(anchor, null, null, List.of(run));
    }

    public static Hyperlink external(String location, String tooltip, List<Run> runs) {
        return new Hyperlink(null, location, tooltip, runs);
    }

    @JsonIgnore
    public boolean isInternal() {
        return anchor != null;
    }

    public Hyperlink mapRuns(UnaryOperator<Run> mapper) {
        return new Hyperlink(anchor, location, tooltip, runs.stream().map(mapper).collect(Collectors.toList()));
    }

    @Override
    public String text() {
        return runs.stream().map(Run::text).collect(Collectors.joining());
    }
}
