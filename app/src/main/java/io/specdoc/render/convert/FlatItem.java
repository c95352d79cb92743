package io.specdoc.render.convert;

import io.specdoc.render.markdown.Block;
import java.util.Objects;

/**
 * One block of a flattened list. Only the first paragraph of an item carries the bullet or number; every other
 * block of the item is a continuation at the same level.
 */
public record FlatItem(int level, boolean hasBullet, boolean ordered, boolean firstOfItem, Block content) {

    public FlatItem {
        Objects.requireNonNull(content, "content");
    }
}
