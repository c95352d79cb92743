package io.specdoc.render.markdown;

import java.util.List;
import java.util.Objects;

public record ListBlock(boolean ordered, List<Item> items, SourceRange range) implements Block {

    public ListBlock {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        range = Objects.requireNonNullElse(range, SourceRange.UNKNOWN);
    }

    public ListBlock(boolean ordered, List<Item> items) {
        this(ordered, items, SourceRange.UNKNOWN);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitListBlock(this);
    }

    /**
     * Blocks making up one list item, in source order.
     */
    public record Item(List<Block> blocks) {

        public Item {
            blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
        }

        public static Item of(Block... blocks) {
            return new Item(List.of(blocks));
        }
    }
}
