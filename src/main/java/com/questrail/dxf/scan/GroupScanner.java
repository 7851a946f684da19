package com.questrail.dxf.scan;

import com.questrail.dxf.MalformedInputException;
import com.questrail.dxf.ReadPastEndException;
import com.questrail.dxf.UnexpectedEndOfInputException;
import com.questrail.dxf.observability.DxfDiagnosticsSink;
import com.questrail.dxf.observability.DxfWarningEvent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * GroupScanner
 * =============================================================================
 * Sequential cursor over the raw lines of a DXF group stream.
 *
 * <h2>Cursor model</h2>
 * The cursor always points at the code line of the next unread group and moves
 * by exactly two lines per group. The scanner is exhausted once the
 * {@code 0/EOF} group has been read; reading again is a {@link ReadPastEndException}
 * unless the cursor is first rewound before that group.
 *
 * <h2>Lookahead</h2>
 * <ul>
 *   <li>{@link #peek()} converts the next group without consuming it.</li>
 *   <li>{@link #nextIf(IntPredicate)} reads one group and undoes the read when its
 *       code does not match. Structural parsers use it for optional trailing
 *       components.</li>
 *   <li>{@link #rewind(int)} is the raw primitive behind both. Callers must only
 *       rewind over groups they have actually read.</li>
 * </ul>
 *
 * Groups are converted once and cached, so a group read, rewound and read
 * again reports an undefined code to the diagnostics sink only once.
 *
 * <p>A scanner is created for a single parse pass and is not thread-safe.</p>
 */
public final class GroupScanner
{
    private final List<String> lines;
    private final DxfDiagnosticsSink diagnostics;
    private final Group[] decoded;

    private int position;
    private boolean exhausted;
    private int eofPosition = -1;

    public GroupScanner(List<String> lines, DxfDiagnosticsSink diagnostics) {
        this.lines = Objects.requireNonNull(lines, "lines");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.decoded = new Group[lines.size() / 2 + 1];
    }

    public static GroupScanner of(String text, DxfDiagnosticsSink diagnostics) {
        return new GroupScanner(DxfLines.split(text), diagnostics);
    }

    /**
     * Reads the next group and records it as the last read group.
     *
     * @throws UnexpectedEndOfInputException if the lines run out before {@code EOF}
     * @throws ReadPastEndException          if {@code EOF} has already been read
     */
    public Group next() {
        Group group = groupAt(position);
        position += 2;
        if (group.isEof()) {
            exhausted = true;
            eofPosition = position - 2;
        }
        return group;
    }

    /**
     * Returns the group {@link #next()} would return, without moving the cursor.
     */
    public Group peek() {
        return groupAt(position);
    }

    /**
     * Reads the next group if its code satisfies {@code accept}; otherwise the
     * read is undone and the cursor is left where it was.
     */
    public Optional<Group> nextIf(IntPredicate accept) {
        Group candidate = next();
        if (accept.test(candidate.code())) {
            return Optional.of(candidate);
        }
        rewind();
        return Optional.empty();
    }

    public void rewind() {
        rewind(1);
    }

    /**
     * Moves the cursor back by {@code groups} groups.
     *
     * @throws IllegalStateException if that would move before the first line
     */
    public void rewind(int groups) {
        if (groups < 0) {
            throw new IllegalArgumentException("groups must be >= 0: " + groups);
        }
        int target = position - 2 * groups;
        if (target < 0) {
            throw new IllegalStateException(
                "Cannot rewind " + groups + " groups from line " + position);
        }
        position = target;
        if (exhausted && position <= eofPosition) {
            exhausted = false;
        }
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * The group immediately before the cursor: the most recently read group, or
     * after a rewind the last group that is still consumed.
     *
     * @throws IllegalStateException if nothing has been read
     */
    public Group lastRead() {
        if (position < 2) {
            throw new IllegalStateException("No group has been read");
        }
        return decoded[(position - 2) / 2];
    }

    /** Line index of the next unread group. */
    public int position() {
        return position;
    }

    private Group groupAt(int line) {
        if (exhausted) {
            throw new ReadPastEndException("Cannot call next after EOF");
        }
        if (line + 1 >= lines.size()) {
            throw new UnexpectedEndOfInputException(
                "Unexpected end of input at line " + (line + 1) + ": EOF group not found");
        }
        int index = line / 2;
        Group group = decoded[index];
        if (group == null) {
            group = decode(line);
            decoded[index] = group;
        }
        return group;
    }

    private Group decode(int line) {
        String codeLine = lines.get(line).trim();
        int code;
        try {
            code = Integer.parseInt(codeLine);
        }
        catch (NumberFormatException e) {
            throw new MalformedInputException(
                "Line " + (line + 1) + ": group code '" + codeLine + "' is not an integer", e);
        }
        if (!GroupCodes.isDefined(code)) {
            diagnostics.onWarning(new DxfWarningEvent(DxfWarningEvent.Kind.UNDEFINED_VALUE_TYPE,
                "STREAM", "Group code " + code + " at line " + (line + 1) + " has no defined value type"));
        }
        String value = lines.get(line + 1).stripLeading();
        return new Group(code, GroupCodes.parseValue(code, value));
    }
}
