package io.specdoc.render.convert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Aho-Corasick automaton over a fixed set of terms. Matches are reported leftmost first, longest first at
 * equal start, and never overlap.
 */
public final class TermMatcher {

    private final List<String> patterns;
    private final List<Map<Character, Integer>> transitions = new ArrayList<>();
    private final List<Integer> failure = new ArrayList<>();
    private final List<List<Integer>> outputs = new ArrayList<>();

    private TermMatcher(Collection<String> terms) {
        this.patterns = terms.stream().filter(term -> !term.isEmpty()).distinct().toList();
        newState();
        for (int id = 0; id < patterns.size(); id++) {
            insert(patterns.get(id), id);
        }
        linkFailures();
    }

    public static TermMatcher of(Collection<String> terms) {
        return new TermMatcher(terms);
    }

    public int size() {
        return patterns.size();
    }

    public List<Match> find(String text) {
        List<Match> candidates = new ArrayList<>();
        int state = 0;
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            while (state != 0 && !transitions.get(state).containsKey(ch)) {
                state = failure.get(state);
            }
            state = transitions.get(state).getOrDefault(ch, 0);
            for (int id : outputs.get(state)) {
                String pattern = patterns.get(id);
                candidates.add(new Match(index + 1 - pattern.length(), pattern));
            }
        }
        candidates.sort(Comparator.comparingInt(Match::start)
                .thenComparing(Comparator.comparingInt((Match match) -> match.term().length()).reversed()));
        List<Match> selected = new ArrayList<>();
        int end = 0;
        for (Match candidate : candidates) {
            if (candidate.start() >= end) {
                selected.add(candidate);
                end = candidate.end();
            }
        }
        return selected;
    }

    private int newState() {
        transitions.add(new HashMap<>());
        failure.add(0);
        outputs.add(new ArrayList<>());
        return transitions.size() - 1;
    }

    private void insert(String pattern, int id) {
        int state = 0;
        for (int index = 0; index < pattern.length(); index++) {
            char ch = pattern.charAt(index);
            Integer next = transitions.get(state).get(ch);
            if (next == null) {
                next = newState();
                transitions.get(state).put(ch, next);
            }
            state = next;
        }
        outputs.get(state).add(id);
    }

    private void linkFailures() {
        Queue<Integer> queue = new ArrayDeque<>();
        for (int child : transitions.get(0).values()) {
            failure.set(child, 0);
            queue.add(child);
        }
        while (!queue.isEmpty()) {
            int state = queue.remove();
            for (Map.Entry<Character, Integer> edge : transitions.get(state).entrySet()) {
                char ch = edge.getKey();
                int child = edge.getValue();
                int fallback = failure.get(state);
                while (fallback != 0 && !transitions.get(fallback).containsKey(ch)) {
                    fallback = failure.get(fallback);
                }
                int target = transitions.get(fallback).getOrDefault(ch, 0);
                failure.set(child, target == child ? 0 : target);
                outputs.get(child).addAll(outputs.get(failure.get(child)));
                queue.add(child);
            }
        }
    }

    public record Match(int start, String term) {

        public int end() {
            return start + term.length();
        }
    }
}
