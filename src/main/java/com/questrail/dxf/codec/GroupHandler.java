package com.questrail.dxf.codec;

import com.questrail.dxf.scan.Group;

/**
 * One step of a record reconstructor: offered the group just read, it either
 * consumes it (together with any follow-up groups it needs) and returns
 * {@code true}, or declines it.
 *
 * <p>A handler that reads past its own groups must rewind, leaving the scanner on
 * the last group it consumed.</p>
 */
@FunctionalInterface
public interface GroupHandler<R>
{
    boolean handle(R record, Group group, ParseContext context);

    default GroupHandler<R> or(GroupHandler<? super R> next) {
        return (record, group, context) ->
            handle(record, group, context) || next.handle(record, group, context);
    }
}
