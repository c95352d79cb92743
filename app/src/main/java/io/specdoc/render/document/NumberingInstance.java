package io.specdoc.render.document;

public record NumberingInstance(int id, int abstractId) {
}
