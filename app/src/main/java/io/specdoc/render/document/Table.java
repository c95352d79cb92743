package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class Table implements DocBlock {

    private final TableProperties properties;
    private final List<TableRow> rows = new ArrayList<>();

    public Table(TableProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public TableProperties properties() {
        return properties;
    }

    public Table addRow(TableRow row) {
        rows.add(Objects.requireNonNull(row, "row"));
        return this;
    }

    public List<TableRow> rows() {
        return Collections.unmodifiableList(rows);
    }

    @Override
    public String toString() {
        return "Table{" + properties + ", " + rows + '}';
    }
}
