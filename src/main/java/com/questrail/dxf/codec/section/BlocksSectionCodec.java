package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.ApplicationGroups;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.Block;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.EndBlock;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * BlocksSectionCodec
 * -----------------------------------------------------------------------------
 * The {@code BLOCKS} section.
 *
 * <pre>
 *   0/BLOCK   block fields
 *   0/LINE    ...             nested entities
 *   0/ENDBLK  end block fields
 * </pre>
 *
 * Blocks are keyed by name; a block without one is dropped with a warning.
 */
public final class BlocksSectionCodec implements SectionCodec
{
    public static final String NAME = "BLOCKS";
    static final String BLOCK = "BLOCK";
    static final String END_BLOCK = "ENDBLK";

    private static final int HANDLE = 5;
    private static final int SUBCLASS_MARKER = 100;

    private static final RecordSchema<Block> SCHEMA = RecordSchema.<Block>builder()
        .text(330, Block::getOwnerHandle, Block::setOwnerHandle)
        .text(8, Block::getLayer, Block::setLayer)
        .flag(67, Block::getInPaperSpace, Block::setInPaperSpace)
        .text(2, Block::getName, Block::setName)
        .integer(70, Block::getFlags, Block::setFlags)
        .point(10, Block::getBasePoint, Block::setBasePoint)
        .text(3, Block::getSecondName, Block::setSecondName)
        .text(1, Block::getXrefPath, Block::setXrefPath)
        .text(4, Block::getDescription, Block::setDescription)
        .build();

    private static final RecordSchema<EndBlock> END_SCHEMA = RecordSchema.<EndBlock>builder()
        .text(HANDLE, EndBlock::getHandle, EndBlock::setHandle)
        .text(330, EndBlock::getOwnerHandle, EndBlock::setOwnerHandle)
        .text(8, EndBlock::getLayer, EndBlock::setLayer)
        .flag(67, EndBlock::getInPaperSpace, EndBlock::setInPaperSpace)
        .build();

    private final EntityCodecRegistry entityCodecs;

    public BlocksSectionCodec(EntityCodecRegistry entityCodecs) {
        this.entityCodecs = Objects.requireNonNull(entityCodecs, "entityCodecs");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isPresent(DxfDocument document) {
        return document.getBlocks().isPresent();
    }

    @Override
    public int read(ParseContext context, DxfDocument document) {
        Map<String, Block> blocks = new LinkedHashMap<>();
        document.setBlocks(blocks);
        SectionBodies.readRecords(context, NAME, BLOCK, () -> {
            Block block = readBlock(context);
            if (block.getName() == null) {
                context.warn(DxfWarningEvent.Kind.MISSING_NAME, BLOCK,
                    "Block with handle " + block.getHandle() + " has no name and was dropped");
            }
            else {
                blocks.put(block.getName(), block);
            }
        });
        return blocks.size();
    }

    private static Block readBlock(ParseContext context) {
        Block block = context.readFields(BLOCK, new Block(), SCHEMA.or(BlocksSectionCodec::readBlockField));
        Group end = EntityLists.read(context, block.getEntities(), END_BLOCK, BLOCK);
        if (!end.isMarker(END_BLOCK)) {
            context.warn(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE, BLOCK,
                "Block " + block.getName() + " is not closed by " + END_BLOCK);
            return block;
        }
        EndBlock endBlock = context.readFields(END_BLOCK, new EndBlock(),
            END_SCHEMA.or((record, group, ctx) -> group.code() == SUBCLASS_MARKER));
        if (!endBlock.isEmpty()) {
            block.setEndBlock(endBlock);
        }
        return block;
    }

    private static boolean readBlockField(Block block, Group group, ParseContext context) {
        return switch (group.code()) {
            case HANDLE -> {
                block.setHandle(group.text());
                yield true;
            }
            case ApplicationGroups.CODE -> {
                if (!ApplicationGroups.isStart(group)) {
                    yield false;
                }
                block.getApplicationGroups().add(ApplicationGroups.read(context, BLOCK));
                yield true;
            }
            case SUBCLASS_MARKER -> true;
            default -> false;
        };
    }

    @Override
    public Stream<Consumer<GroupWriter>> records(DxfDocument document) {
        return document.getBlocks()
            .map(blocks -> blocks.values().stream())
            .orElseGet(Stream::empty)
            .map(this::blockWriter);
    }

    private Consumer<GroupWriter> blockWriter(Block block) {
        return out -> {
            out.marker(BLOCK);
            if (block.getHandle() != null) {
                out.text(HANDLE, block.getHandle());
            }
            ApplicationGroups.write(out, block.getApplicationGroups());
            SCHEMA.write(block, out);
            for (Entity entity : block.getEntities()) {
                EntityLists.write(entityCodecs, entity, out, BLOCK);
            }
            out.marker(END_BLOCK);
            if (block.getEndBlock() != null) {
                END_SCHEMA.write(block.getEndBlock(), out);
            }
        };
    }
}
