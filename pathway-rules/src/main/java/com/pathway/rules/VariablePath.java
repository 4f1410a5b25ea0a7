package com.pathway.rules;

import com.pathway.executioncontext.ParticipantState;
import com.pathway.rules.parse.RuleLexer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Dotted/bracket path into participant state.
 * <p>
 * Roots: {@code responses}/{@code session} (collected responses), {@code scores}, {@code environment}/{@code env}/
 * {@code participant}/{@code url_params}/{@code url} (environment), {@code assignments} (decision key → child ids;
 * a single assigned child reads as a plain string) and {@code pick_assigns} (accumulated pick values).
 * Any other first segment is read as a stage id in responses, then as an environment key.
 * <p>
 * For the environment aliases {@code participant}, {@code url_params} and {@code url}, a nested map stored under
 * the alias name is consulted first, so both {@code {"age": 30}} and {@code {"participant": {"age": 30}}} resolve
 * {@code participant.age}.
 */
public final class VariablePath {

    public enum Root {
        RESPONSES,
        SCORES,
        ENVIRONMENT,
        ASSIGNMENTS,
        PICK_ASSIGNS,
        /** First segment is a stage id (responses) or an environment key. */
        IMPLICIT
    }

    private final String text;
    private final Root root;
    private final String rootName;
    private final List<String> segments;

    private VariablePath(String text, Root root, String rootName, List<String> segments) {
        this.text = text;
        this.root = root;
        this.rootName = rootName;
        this.segments = List.copyOf(segments);
    }

    /** Path from already split segments (as produced by the lexer). */
    public static VariablePath of(String text, List<String> rawSegments) {
        Objects.requireNonNull(rawSegments, "rawSegments");
        if (rawSegments.isEmpty()) throw new IllegalArgumentException("Empty variable path");
        String first = rawSegments.get(0);
        Root root = rootOf(first);
        List<String> rest = root == Root.IMPLICIT ? rawSegments : rawSegments.subList(1, rawSegments.size());
        return new VariablePath(text, root, first.toLowerCase(Locale.ROOT), rest);
    }

    /**
     * Parses a path as rules write it: {@code participant.age}, {@code responses['consent'].agree}, {@code scores[phq9]}.
     *
     * @throws RuleSyntaxException when the text is not a single variable path
     */
    public static VariablePath parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        return of(trimmed, RuleLexer.pathSegments(trimmed));
    }

    private static Root rootOf(String first) {
        switch (first.toLowerCase(Locale.ROOT)) {
            case "responses":
            case "session":
                return Root.RESPONSES;
            case "scores":
                return Root.SCORES;
            case "environment":
            case "env":
            case "participant":
            case "url_params":
            case "url":
                return Root.ENVIRONMENT;
            case "assignments":
                return Root.ASSIGNMENTS;
            case "pick_assigns":
                return Root.PICK_ASSIGNS;
            default:
                return Root.IMPLICIT;
        }
    }

    public String getText() {
        return text;
    }

    public Root getRoot() {
        return root;
    }

    /** Segments below the root (all segments for {@link Root#IMPLICIT}). */
    public List<String> getSegments() {
        return segments;
    }

    /** Value at this path, or null when any segment is missing. */
    public Object resolve(ParticipantState state) {
        switch (root) {
            case RESPONSES:
                return navigate(state.getResponses(), segments);
            case SCORES:
                return navigate(state.getScores(), segments);
            case ENVIRONMENT:
                return resolveEnvironment(state);
            case ASSIGNMENTS: {
                if (segments.isEmpty()) return state.getAssignments();
                List<String> assigned = state.getAssignment(segments.get(0));
                if (assigned == null) return null;
                Object value = assigned.size() == 1 ? assigned.get(0) : assigned;
                return segments.size() == 1 ? value : navigate(value, segments.subList(1, segments.size()));
            }
            case PICK_ASSIGNS:
                if (segments.isEmpty()) return state.getPickAssignments();
                return state.pickValues(segments.get(0));
            default: {
                String first = segments.get(0);
                if (state.getResponses().containsKey(first)) {
                    return navigate(state.getResponses(), segments);
                }
                return navigate(state.getEnvironment(), segments);
            }
        }
    }

    private Object resolveEnvironment(ParticipantState state) {
        Map<String, Object> env = state.getEnvironment();
        boolean alias = !"environment".equals(rootName) && !"env".equals(rootName);
        if (alias) {
            String nestedKey = "url".equals(rootName) ? "url_params" : rootName;
            Object nested = env.get(nestedKey);
            if (nested instanceof Map) {
                Object value = navigate(nested, segments);
                if (value != null) return value;
            }
        }
        return navigate(env, segments);
    }

    private static Object navigate(Object current, List<String> path) {
        for (String segment : path) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(segment);
            } else if (current instanceof List) {
                List<?> list = (List<?>) current;
                try {
                    int idx = Integer.parseInt(segment);
                    current = idx >= 0 && idx < list.size() ? list.get(idx) : null;
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }

    /**
     * Writes a value at this path into the state (used to synthesize participants). Intermediate maps are created;
     * assignments and pick assigns are written as single-element lists.
     */
    public void assign(ParticipantState state, Object value) {
        switch (root) {
            case RESPONSES:
                writeNested(state, segments, value, Target.RESPONSES);
                break;
            case SCORES:
                writeNested(state, segments, value, Target.SCORES);
                break;
            case ENVIRONMENT:
            case IMPLICIT:
                if (root == Root.IMPLICIT && segments.size() > 1) {
                    writeNested(state, segments, value, Target.RESPONSES);
                } else {
                    writeNested(state, segments, value, Target.ENVIRONMENT);
                }
                break;
            case ASSIGNMENTS:
                if (!segments.isEmpty() && value != null) state.assign(segments.get(0), List.of(Values.asText(value)));
                break;
            case PICK_ASSIGNS:
                if (!segments.isEmpty() && value != null) {
                    state.accumulatePickAssigns(Map.of(segments.get(0), List.of(Values.asText(value))));
                }
                break;
            default:
                break;
        }
    }

    private enum Target { RESPONSES, SCORES, ENVIRONMENT }

    @SuppressWarnings("unchecked")
    private static void writeNested(ParticipantState state, List<String> path, Object value, Target target) {
        if (path.isEmpty()) return;
        Map<String, Object> source = target == Target.RESPONSES ? state.getResponses()
                : target == Target.SCORES ? state.getScores() : state.getEnvironment();
        String head = path.get(0);
        Object leaf = value;
        if (path.size() > 1) {
            Object existing = source.get(head);
            Map<String, Object> top = existing instanceof Map
                    ? new LinkedHashMap<>((Map<String, Object>) existing)
                    : new LinkedHashMap<>();
            Map<String, Object> cursor = top;
            for (int i = 1; i < path.size() - 1; i++) {
                Object next = cursor.get(path.get(i));
                Map<String, Object> child = next instanceof Map
                        ? new LinkedHashMap<>((Map<String, Object>) next)
                        : new LinkedHashMap<>();
                cursor.put(path.get(i), child);
                cursor = child;
            }
            cursor.put(path.get(path.size() - 1), value);
            leaf = top;
        }
        switch (target) {
            case RESPONSES:
                state.putResponse(head, leaf);
                break;
            case SCORES:
                state.putScore(head, leaf);
                break;
            default:
                state.putEnvironment(head, leaf);
                break;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((VariablePath) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
