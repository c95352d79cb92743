package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import java.util.Optional;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class TableProperties {

    private final String styleId;
    private final String borders = "single";
    private final Integer width;
    private int indentation;

    public TableProperties(String styleId, int indentation, Integer width) {
        this.styleId = styleId;
        this.indentation = indentation;
        this.width = width;
    }

    public String styleId() {
        return styleId;
    }

    public String borders() {
        return borders;
    }

    public Optional<Integer> width() {
        return Optional.ofNullable(width);
    }

    public int indentation() {
        return indentation;
    }

    public void indentation(int value) {
        this.indentation = value;
    }

    @Override
    public String toString() {
        return "TableProperties{style=" + styleId + ", indentation=" + indentation + ", width=" + width + '}';
    }
}
