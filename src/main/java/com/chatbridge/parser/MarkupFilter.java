package com.chatbridge.parser;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Incremental scanner that removes the backend's internal markup from text.
 *
 * <p>Grammar: a tag is exactly {@code <name>} or {@code </name>} where {@code name} is one of the
 * known names below; no attributes, no whitespace. Anything else starting with {@code <} is literal text.</p>
 * <ul>
 *   <li>Dropped blocks: the tags and everything between them are removed. Nesting of the same tag
 *       is counted, other tags inside a dropped block are plain content.</li>
 *   <li>{@code tool_call} is dropped like the others but its body is returned for tool extraction.</li>
 *   <li>Unwrapped tags are removed and their content kept.</li>
 * </ul>
 * A stray closing tag or a block still open at {@link #finish()} is reported as a warning.
 *
 * <p>Text that might be the start of a tag split across chunks is held back until the next
 * {@link #feed(String)} resolves it. Not thread-safe; one instance per response.</p>
 */
public class MarkupFilter {

    static final Set<String> DROPPED_TAGS = Set.of(
            "thinking", "read_file", "write_file", "bash", "search_files", "str_replace_editor", "args",
            "ask_followup_question", "question", "follow_up", "suggest", "tool_call"
    );
    static final Set<String> UNWRAPPED_TAGS = Set.of("attempt_completion", "result");

    private static final String CAPTURED_TAG = "tool_call";

    private final StringBuilder pending = new StringBuilder();
    private String buf = "";
    private String openTag;
    private int depth;
    private StringBuilder capturedBody;
    private int droppedChars;

    public Output feed(String text) {
        if (text == null || text.isEmpty()) {
            return Output.EMPTY;
        }
        pending.append(text);
        return drain(false);
    }

    public Output finish() {
        return drain(true);
    }

    public boolean insideBlock() {
        return openTag != null;
    }

    private Output drain(boolean last) {
        StringBuilder out = new StringBuilder();
        List<String> bodies = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int i = 0;
        buf = pending.toString();
        int length = buf.length();

        while (i < length) {
            int lt = buf.indexOf("<", i);
            if (openTag == null) {
                if (lt < 0) {
                    out.append(buf, i, length);
                    i = length;
                    break;
                }
                out.append(buf, i, lt);
                Match match = match(lt, null);
                if (match.isPartial() && !last) {
                    i = lt;
                    break;
                }
                if (match.getName() == null) {
                    out.append('<');
                    i = lt + 1;
                    continue;
                }
                if (DROPPED_TAGS.contains(match.getName())) {
                    if (match.isClosing()) {
                        warnings.add("stray </" + match.getName() + "> removed");
                    } else {
                        openTag = match.getName();
                        depth = 1;
                        droppedChars = 0;
                        capturedBody = CAPTURED_TAG.equals(openTag) ? new StringBuilder() : null;
                    }
                }
                i = match.getEnd();
            } else {
                if (lt < 0) {
                    capture(i, length);
                    i = length;
                    break;
                }
                capture(i, lt);
                Match match = match(lt, openTag);
                if (match.isPartial() && !last) {
                    i = lt;
                    break;
                }
                if (match.getName() == null) {
                    capture(lt, lt + 1);
                    i = lt + 1;
                    continue;
                }
                if (match.isClosing()) {
                    depth--;
                    if (depth == 0) {
                        if (capturedBody != null) {
                            bodies.add(capturedBody.toString());
                        }
                        openTag = null;
                        capturedBody = null;
                    } else {
                        capture(lt, match.getEnd());
                    }
                } else {
                    depth++;
                    capture(lt, match.getEnd());
                }
                i = match.getEnd();
            }
        }
        pending.delete(0, i);

        if (last) {
            if (pending.length() > 0) {
                out.append(pending);
                pending.setLength(0);
            }
            if (openTag != null) {
                warnings.add("unclosed <" + openTag + "> block, " + droppedChars + " character(s) withheld");
                openTag = null;
                capturedBody = null;
                depth = 0;
            }
        }
        return new Output(out.toString(), bodies, warnings);
    }

    private void capture(int from, int to) {
        droppedChars += to - from;
        if (capturedBody != null) {
            capturedBody.append(buf, from, to);
        }
    }

    private Match match(int lt, String only) {
        boolean partial = false;
        int available = buf.length() - lt;
        Iterable<String> candidates = only != null ? Set.of(only) : allTags();
        for (String name : candidates) {
            for (String token : new String[]{"<" + name + ">", "</" + name + ">"}) {
                if (available >= token.length()) {
                    if (buf.startsWith(token, lt)) {
                        return new Match(name, token.charAt(1) == '/', lt + token.length(), false);
                    }
                } else if (token.regionMatches(0, buf, lt, available)) {
                    partial = true;
                }
            }
        }
        return new Match(null, false, lt + 1, partial);
    }

    private static Iterable<String> allTags() {
        List<String> all = new ArrayList<>(DROPPED_TAGS);
        all.addAll(UNWRAPPED_TAGS);
        return all;
    }

    @Value
    private static class Match {
        String name;
        boolean closing;
        int end;
        boolean partial;
    }

    @Value
    public static class Output {
        static final Output EMPTY = new Output("", List.of(), List.of());

        String text;
        List<String> toolCallBodies;
        List<String> warnings;
    }
}
