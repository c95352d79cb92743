package io.specdoc.render.convert;

import io.specdoc.render.document.DocBlock;
import io.specdoc.render.markdown.Block;
import java.util.List;

/**
 * Recursive entry point handed to builders whose content (table cells, list continuations) holds blocks.
 */
@FunctionalInterface
public interface BlockConverter {

    List<DocBlock> convert(Block block);
}
