package com.datalab.export;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.datalab.model.Conversation;
import com.datalab.model.DatasetItem;
import com.datalab.model.DatasetKind;
import com.datalab.model.Message;
import com.datalab.model.Role;
import com.datalab.pairs.ContextMode;
import com.datalab.store.InMemoryRecordSource;
import com.fasterxml.jackson.databind.json.JsonMapper;

class ExportCoordinatorTest {

    @Test
    void shouldExportWindowedPairForApprovedTrainConversation() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(conversation(1, 1, "train", "approved",
                        Message.of(Role.SYSTEM, "You are helpful"),
                        Message.of(Role.USER, "Hi"),
                        Message.of(Role.ASSISTANT, "Hello")));
        ExportOptions options = ExportOptions.builder()
                .context(ContextMode.WINDOW)
                .contextTurns(6)
                .build();

        String output = export(source, options);

        assertEquals("{\"user\":\"User: Hi\",\"assistant\":\"Hello\"}\n", output);
    }

    @Test
    void shouldFilterConversationsBySplitStatusAndDataset() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .dataset(2, DatasetKind.CONVERSATIONS)
                .conversation(conversation(1, 1, "train", "approved", turn("a", "1")))
                .conversation(conversation(2, 2, "train", "approved", turn("b", "2")))
                .conversation(conversation(3, 2, "valid", "approved", turn("c", "3")))
                .conversation(conversation(4, 2, "train", "draft", turn("d", "4")));

        assertEquals(lines("a", "b"), export(source, ExportOptions.defaults()));
        assertEquals(lines("b"), export(source, ExportOptions.builder().datasetId(2).build()));
        assertEquals(lines("b", "c"), export(source, ExportOptions.builder().datasetId(2).split("all").build()));
        assertEquals(lines("d"), export(source, ExportOptions.builder().status("draft").build()));
    }

    @Test
    void capShouldEmitStablePrefixAndStopMidConversation() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource();
        for (int id = 1; id <= 3; id++) {
            source.conversation(conversation(id, 1, "train", "approved",
                    Message.of(Role.USER, "q" + id),
                    Message.of(Role.ASSISTANT, "a" + id),
                    Message.of(Role.ASSISTANT, "b" + id)));
        }
        ExportCoordinator coordinator = new ExportCoordinator(source);
        ByteArrayOutputStream unlimitedOut = new ByteArrayOutputStream();
        ExportReport unlimited = coordinator.streamExport(ExportOptions.defaults(), unlimitedOut);
        List<String> allLines = splitLines(unlimitedOut);

        for (int cap = 1; cap <= 8; cap++) {
            ByteArrayOutputStream cappedOut = new ByteArrayOutputStream();
            ExportReport capped = coordinator.streamExport(ExportOptions.builder().maxExamples(cap).build(), cappedOut);
            List<String> cappedLines = splitLines(cappedOut);

            assertEquals(Math.min(cap, 6), cappedLines.size());
            assertEquals(allLines.subList(0, cappedLines.size()), cappedLines);
            assertEquals(cappedLines.size(), capped.linesWritten());
        }

        ExportReport stoppedMidway = coordinator.streamExport(
                ExportOptions.builder().maxExamples(3).build(), new ByteArrayOutputStream());
        assertEquals(6, unlimited.linesWritten());
        assertEquals(ExportReport.StopReason.EXHAUSTED, unlimited.stopReason());
        assertEquals(ExportReport.StopReason.LIMIT_REACHED, stoppedMidway.stopReason());
        assertEquals(2, stoppedMidway.recordsRead());
        assertEquals(source.openCursors(), source.closedCursors());
    }

    @Test
    void repeatedExportsShouldBeByteIdentical() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(conversation(5, 1, "train", "approved",
                        Message.of(Role.USER, "Q1"),
                        Message.of(Role.ASSISTANT, "A1"),
                        Message.of(Role.USER, "Q2 <b>"),
                        Message.of(Role.ASSISTANT, "A2")));
        ExportOptions options = ExportOptions.builder().context(ContextMode.FULL).build();
        ExportCoordinator coordinator = new ExportCoordinator(source);

        ByteArrayOutputStream first = new ByteArrayOutputStream();
        ByteArrayOutputStream second = new ByteArrayOutputStream();
        coordinator.streamExport(options, first);
        coordinator.streamExport(options, second);

        assertArrayEquals(first.toByteArray(), second.toByteArray());
    }

    @Test
    void shouldExportConversationsVerbatimWithSortedKeys() throws IOException {
        Message named = new Message("user", "Hi", "alice",
                JsonMapper.builder().build().readTree("{\"lang\":\"en\"}"));
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(new Conversation(7, 1, "train", "approved", List.of("greeting"), "import:chat.jsonl",
                        "checked", List.of(named, Message.of(Role.ASSISTANT, "  Hello  "))));

        String output = export(source, ExportOptions.builder().type(ExportType.CONVERSATIONS).build());

        assertEquals("{\"id\":7,\"messages\":[{\"role\":\"user\",\"content\":\"Hi\",\"name\":\"alice\",\"meta\":{\"lang\":\"en\"}},"
                + "{\"role\":\"assistant\",\"content\":\"  Hello  \"}],\"notes\":\"checked\",\"source\":\"import:chat.jsonl\","
                + "\"split\":\"train\",\"status\":\"approved\",\"tags\":[\"greeting\"]}\n", output);
    }

    @Test
    void shouldKeepStoredRolesInConversationsExport() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(new Conversation(1, 1, "train", "approved", List.of(), "", "", List.of(
                        Message.of(Role.USER, "Look it up"),
                        new Message("tool", "T", "search", null),
                        Message.of(Role.ASSISTANT, "Found it"))));

        String conversations = export(source, ExportOptions.builder().type(ExportType.CONVERSATIONS).build());
        String pairs = export(source, ExportOptions.builder().context(ContextMode.FULL).build());

        assertEquals("{\"id\":1,\"messages\":[{\"role\":\"user\",\"content\":\"Look it up\"},"
                + "{\"role\":\"tool\",\"content\":\"T\",\"name\":\"search\"},"
                + "{\"role\":\"assistant\",\"content\":\"Found it\"}],\"notes\":\"\",\"source\":\"\","
                + "\"split\":\"train\",\"status\":\"approved\",\"tags\":[]}\n", conversations);
        assertEquals("{\"user\":\"User: Look it up\",\"assistant\":\"Found it\"}\n", pairs);
    }

    @Test
    void shouldPassItemDataThroughUnchanged() throws IOException {
        InMemoryRecordSource source = itemsSource();

        String output = export(source, ExportOptions.builder().type(ExportType.ITEMS).datasetId(5).build());

        assertEquals("{\"user\": \"Hi\",  \"assistant\": \"Hello\"}\n[1, 2]\n"
                + "{\"messages\": [{\"role\": \"user\", \"content\": \"Q\"}, {\"role\": \"assistant\", \"content\": \"A\"}]}\n",
                output);
    }

    @Test
    void shouldWrapItemDataWithMetadata() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .dataset(5, DatasetKind.ITEMS)
                .item(new DatasetItem(1, 5, "{ \"score\" : 2.50, \"tags\": [\"a\", \"b\"] }", "ref-1"));

        String output = export(source, ExportOptions.builder().type(ExportType.ITEMS_WITH_META).datasetId(5).build());

        assertEquals("{\"data\":{\"score\":2.50,\"tags\":[\"a\",\"b\"]},\"dataset_id\":5,\"id\":1,\"source_ref\":\"ref-1\"}\n",
                output);
    }

    @Test
    void shouldDerivePairsFromRecognizedItemsOnly() throws IOException {
        InMemoryRecordSource source = itemsSource();

        ExportCoordinator coordinator = new ExportCoordinator(source);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ExportReport report = coordinator.streamExport(ExportOptions.builder().datasetId(5).build(), out);

        assertEquals("{\"user\":\"Hi\",\"assistant\":\"Hello\"}\n{\"user\":\"Q\",\"assistant\":\"A\"}\n",
                out.toString(StandardCharsets.UTF_8));
        assertEquals(ExportMode.ITEM_PAIRS, report.mode());
        assertEquals(3, report.recordsRead());
        assertEquals(2, report.linesWritten());
    }

    @Test
    void shouldRejectInvalidCombinationsBeforeWriting() {
        InMemoryRecordSource source = itemsSource().dataset(9, DatasetKind.CONVERSATIONS);
        ExportCoordinator coordinator = new ExportCoordinator(source);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertThrows(ExportConfigurationException.class, () -> coordinator.streamExport(
                ExportOptions.builder().type(ExportType.CONVERSATIONS).datasetId(5).build(), out));
        assertThrows(ExportConfigurationException.class, () -> coordinator.streamExport(
                ExportOptions.builder().type(ExportType.ITEMS).build(), out));
        assertThrows(ExportConfigurationException.class, () -> coordinator.streamExport(
                ExportOptions.builder().type(ExportType.ITEMS_WITH_META).datasetId(9).build(), out));
        DatasetNotFoundException missing = assertThrows(DatasetNotFoundException.class, () -> coordinator.streamExport(
                ExportOptions.builder().datasetId(42).build(), out));

        assertEquals(42, missing.datasetId());
        assertEquals(0, out.size());
        assertEquals(0, source.openCursors());
    }

    @Test
    void shouldSurfaceSinkFailureAndReleaseCursor() {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(conversation(1, 1, "train", "approved", turn("q1", "a1")))
                .conversation(conversation(2, 1, "train", "approved", turn("q2", "a2")));
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        OutputStream disconnecting = new DisconnectingOutputStream(received, 1);

        ExportStreamException failure = assertThrows(ExportStreamException.class,
                () -> new ExportCoordinator(source).streamExport(ExportOptions.defaults(), disconnecting));

        assertEquals(ExportStreamException.Failure.SINK, failure.failure());
        assertEquals(1, failure.linesWritten());
        assertEquals("{\"user\":\"q1\",\"assistant\":\"a1\"}\n", received.toString(StandardCharsets.UTF_8));
        assertEquals(1, source.closedCursors());
    }

    @Test
    void shouldSurfaceSourceFailureAfterCompleteLines() {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(conversation(1, 1, "train", "approved", turn("q1", "a1")))
                .conversation(conversation(2, 1, "train", "approved", turn("q2", "a2")))
                .failAfter(1);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ExportStreamException failure = assertThrows(ExportStreamException.class,
                () -> new ExportCoordinator(source).streamExport(ExportOptions.defaults(), out));

        assertEquals(ExportStreamException.Failure.SOURCE, failure.failure());
        assertEquals(1, failure.linesWritten());
        assertTrue(out.toString(StandardCharsets.UTF_8).endsWith("\n"));
        assertEquals(1, source.closedCursors());
    }

    @Test
    void shouldStopWhenCancelled() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(conversation(1, 1, "train", "approved",
                        Message.of(Role.USER, "q"),
                        Message.of(Role.ASSISTANT, "a1"),
                        Message.of(Role.ASSISTANT, "a2")))
                .conversation(conversation(2, 1, "train", "approved", turn("q2", "a3")));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ExportReport report = new ExportCoordinator(source)
                .streamExport(ExportOptions.defaults(), out, () -> out.size() > 0);

        assertEquals(ExportReport.StopReason.CANCELLED, report.stopReason());
        assertEquals(1, report.linesWritten());
        assertEquals(1, splitLines(out).size());
        assertEquals(1, source.closedCursors());
    }

    @Test
    void shouldWriteNothingWhenNoRecordsMatch() throws IOException {
        InMemoryRecordSource source = new InMemoryRecordSource()
                .conversation(conversation(1, 1, "test", "approved", turn("q", "a")));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ExportReport report = new ExportCoordinator(source).streamExport(ExportOptions.defaults(), out);

        assertEquals(0, out.size());
        assertEquals(ExportReport.StopReason.EXHAUSTED, report.stopReason());
    }

    private static InMemoryRecordSource itemsSource() {
        return new InMemoryRecordSource()
                .dataset(5, DatasetKind.ITEMS)
                .item(new DatasetItem(3, 5,
                        "{\"messages\": [{\"role\": \"user\", \"content\": \"Q\"}, {\"role\": \"assistant\", \"content\": \"A\"}]}",
                        "ref-3"))
                .item(new DatasetItem(1, 5, "{\"user\": \"Hi\",  \"assistant\": \"Hello\"}", "ref-1"))
                .item(new DatasetItem(2, 5, "[1, 2]", "ref-2"))
                .item(new DatasetItem(4, 6, "{\"user\":\"other\",\"assistant\":\"dataset\"}", "ref-4"));
    }

    private static String export(InMemoryRecordSource source, ExportOptions options) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ExportCoordinator(source).streamExport(options, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static Conversation conversation(long id, long datasetId, String split, String status, Message... messages) {
        return new Conversation(id, datasetId, split, status, List.of(), "", "", Arrays.asList(messages));
    }

    private static Message[] turn(String user, String assistant) {
        return new Message[] { Message.of(Role.USER, user), Message.of(Role.ASSISTANT, assistant) };
    }

    private static String lines(String... users) {
        StringBuilder builder = new StringBuilder();
        for (String user : users) {
            builder.append("{\"user\":\"").append(user).append("\",\"assistant\":\"")
                    .append(answerFor(user)).append("\"}\n");
        }
        return builder.toString();
    }

    private static String answerFor(String user) {
        switch (user) {
            case "a":
                return "1";
            case "b":
                return "2";
            case "c":
                return "3";
            default:
                return "4";
        }
    }

    private static List<String> splitLines(ByteArrayOutputStream out) {
        String text = out.toString(StandardCharsets.UTF_8);
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.substring(0, text.length() - 1).split("\n", -1));
    }

    private static final class DisconnectingOutputStream extends OutputStream {
        private final OutputStream delegate;
        private final int linesBeforeDisconnect;
        private int lines;

        DisconnectingOutputStream(OutputStream delegate, int linesBeforeDisconnect) {
            this.delegate = delegate;
            this.linesBeforeDisconnect = linesBeforeDisconnect;
        }

        @Override
        public void write(int b) throws IOException {
            if (lines >= linesBeforeDisconnect) {
                throw new IOException("Broken pipe");
            }
            delegate.write(b);
            if (b == '\n') {
                lines++;
            }
        }
    }
}
