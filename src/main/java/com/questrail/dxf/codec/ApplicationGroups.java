package com.questrail.dxf.codec;

import com.questrail.dxf.model.ApplicationGroup;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Application-defined groups: {@code 102/{NAME}, any groups, {@code 102/}}.
 */
public final class ApplicationGroups
{
    public static final int CODE = 102;

    private ApplicationGroups() {}

    public static boolean isStart(Group group) {
        return group.code() == CODE && group.text().startsWith("{");
    }

    /**
     * Reads the group opened by the scanner's last read group, up to and
     * including its closing {@code 102/}}. A code-0 group before the closing
     * marker ends the group early and is left unread.
     */
    public static ApplicationGroup read(ParseContext context, String recordKind) {
        GroupScanner scanner = context.scanner();
        String name = scanner.lastRead().text().substring(1);
        List<Group> groups = new ArrayList<>();
        Group group = scanner.next();
        while (!(group.code() == CODE && group.text().equals("}"))) {
            if (group.startsRecord()) {
                scanner.rewind();
                context.warn(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE, recordKind,
                    "Application group {" + name + " is not closed");
                break;
            }
            groups.add(group);
            group = scanner.next();
        }
        return new ApplicationGroup(name, groups);
    }

    public static void write(GroupWriter out, List<ApplicationGroup> applicationGroups) {
        for (ApplicationGroup applicationGroup : applicationGroups) {
            out.text(CODE, "{" + applicationGroup.name());
            applicationGroup.groups().forEach(out::group);
            out.text(CODE, "}");
        }
    }
}
