package com.datalab.export;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datalab.model.Conversation;
import com.datalab.model.Dataset;
import com.datalab.model.DatasetItem;
import com.datalab.model.DatasetKind;
import com.datalab.pairs.DerivationPolicy;
import com.datalab.pairs.ItemPairDeriver;
import com.datalab.pairs.PairDeriver;
import com.datalab.store.RecordCursor;
import com.datalab.store.RecordSource;

/**
 * Streams a one-shot derived dataset as newline-delimited JSON.
 *
 * <p>The export mode is resolved once from the requested type and the dataset kind, then a single cursor is
 * drained in lock-step with the sink: one source record in memory at a time, each output line flushed as it
 * is produced. Generation stops at the line cap, on cancellation, or when the cursor is exhausted.
 */
public class ExportCoordinator {
    private static final Logger log = LoggerFactory.getLogger(ExportCoordinator.class);

    private final RecordSource source;
    private final PairDeriver pairDeriver;
    private final ItemPairDeriver itemPairDeriver;

    public ExportCoordinator(RecordSource source) {
        this(source, new PairDeriver());
    }

    public ExportCoordinator(RecordSource source, PairDeriver pairDeriver) {
        this(source, pairDeriver, new ItemPairDeriver(pairDeriver));
    }

    public ExportCoordinator(RecordSource source, PairDeriver pairDeriver, ItemPairDeriver itemPairDeriver) {
        this.source = source;
        this.pairDeriver = pairDeriver;
        this.itemPairDeriver = itemPairDeriver;
    }

    public ExportReport streamExport(ExportOptions options, OutputStream sink) throws ExportStreamException {
        return streamExport(options, sink, () -> false);
    }

    /**
     * @param cancellation polled before each record and each line; the calling thread's interrupt flag is
     *        honored as well
     * @throws ExportConfigurationException if the options are not valid for the target dataset; nothing has
     *         been written
     * @throws ExportStreamException if reading records or writing the sink failed part way
     */
    public ExportReport streamExport(ExportOptions options, OutputStream sink, BooleanSupplier cancellation)
            throws ExportStreamException {
        ExportMode mode = resolveMode(options);
        ExportContext context = new ExportContext(options.maxExamples(), cancellation);
        JsonLinesWriter writer = new JsonLinesWriter(sink);

        log.info("export.start mode={} datasetId={} split={} status={} context={} contextTurns={} roleStyle={} includeSystem={} maxExamples={}",
                mode,
                options.datasetId(),
                options.split(),
                options.status(),
                options.context().value(),
                options.contextTurns(),
                options.roleStyle().value(),
                options.includeSystem(),
                options.maxExamples());
        try {
            switch (mode) {
                case CONVERSATION_PAIRS:
                    streamConversationPairs(options, context, writer);
                    break;
                case CONVERSATIONS:
                    streamConversations(options, context, writer);
                    break;
                case ITEM_PAIRS:
                    streamItemPairs(options, context, writer);
                    break;
                case ITEMS:
                    streamItems(options, context, writer, false);
                    break;
                case ITEMS_WITH_META:
                    streamItems(options, context, writer, true);
                    break;
                default:
                    throw new IllegalStateException("Unhandled export mode: " + mode);
            }
        } catch (JsonLinesWriter.SinkWriteException e) {
            log.warn("export.failed mode={} cause=sink linesWritten={} reason={}", mode, context.linesWritten(), e.getMessage());
            throw new ExportStreamException(ExportStreamException.Failure.SINK, context.linesWritten(), e);
        } catch (IOException e) {
            log.error("export.failed mode={} cause=source linesWritten={} reason={}", mode, context.linesWritten(), e.getMessage(), e);
            throw new ExportStreamException(ExportStreamException.Failure.SOURCE, context.linesWritten(), e);
        }

        ExportReport report = context.report(mode);
        if (report.stopReason() == ExportReport.StopReason.CANCELLED) {
            log.info("export.cancelled mode={} recordsRead={} linesWritten={}", mode, report.recordsRead(), report.linesWritten());
        } else {
            log.info("export.completed mode={} recordsRead={} linesWritten={} stopReason={}",
                    mode,
                    report.recordsRead(),
                    report.linesWritten(),
                    report.stopReason());
        }
        return report;
    }

    /**
     * Resolves the generation mode, looking up the dataset kind when a dataset filter is present.
     */
    ExportMode resolveMode(ExportOptions options) throws ExportStreamException {
        if (!options.hasDatasetFilter()) {
            return ExportMode.resolve(options.type(), null);
        }
        Optional<Dataset> dataset;
        try {
            dataset = source.findDataset(options.datasetId());
        } catch (IOException e) {
            throw new ExportStreamException(ExportStreamException.Failure.SOURCE, 0L, e);
        }
        DatasetKind kind = dataset
                .orElseThrow(() -> new DatasetNotFoundException(options.datasetId()))
                .kind();
        return ExportMode.resolve(options.type(), kind);
    }

    private void streamConversationPairs(ExportOptions options, ExportContext context, JsonLinesWriter writer)
            throws IOException {
        DerivationPolicy policy = options.derivationPolicy();
        try (RecordCursor<Conversation> cursor = source.openConversations(options.conversationFilter())) {
            drain(cursor, context, conversation -> writeAll(pairDeriver.derive(conversation.messages(), policy), context, writer));
        }
    }

    private void streamConversations(ExportOptions options, ExportContext context, JsonLinesWriter writer)
            throws IOException {
        try (RecordCursor<Conversation> cursor = source.openConversations(options.conversationFilter())) {
            drain(cursor, context, conversation -> writeAll(List.of(ConversationLine.of(conversation)), context, writer));
        }
    }

    private void streamItemPairs(ExportOptions options, ExportContext context, JsonLinesWriter writer)
            throws IOException {
        DerivationPolicy policy = options.derivationPolicy();
        try (RecordCursor<DatasetItem> cursor = source.openItems(options.datasetId())) {
            drain(cursor, context, item -> writeAll(itemPairDeriver.derive(item, policy), context, writer));
        }
    }

    private void streamItems(ExportOptions options, ExportContext context, JsonLinesWriter writer, boolean withMeta)
            throws IOException {
        try (RecordCursor<DatasetItem> cursor = source.openItems(options.datasetId())) {
            drain(cursor, context, item -> {
                if (context.shouldStop()) {
                    return;
                }
                if (withMeta) {
                    writer.writeValue(new ItemWithMetaLine(
                            writer.compact(item.data()),
                            item.datasetId(),
                            item.id(),
                            item.sourceRef()));
                } else {
                    writer.writeRaw(item.data());
                }
                context.lineWritten();
            });
        }
    }

    private static <T> void drain(RecordCursor<T> cursor, ExportContext context, RecordHandler<T> handler)
            throws IOException {
        while (!context.shouldStop()) {
            Optional<T> next = cursor.next();
            if (next.isEmpty()) {
                return;
            }
            context.recordRead();
            handler.handle(next.get());
        }
    }

    private static void writeAll(List<?> values, ExportContext context, JsonLinesWriter writer) throws IOException {
        for (Object value : values) {
            if (context.shouldStop()) {
                return;
            }
            writer.writeValue(value);
            context.lineWritten();
        }
    }

    @FunctionalInterface
    private interface RecordHandler<T> {
        void handle(T record) throws IOException;
    }
}
