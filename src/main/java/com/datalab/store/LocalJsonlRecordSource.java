package com.datalab.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.datalab.model.Conversation;
import com.datalab.model.Dataset;
import com.datalab.model.DatasetItem;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Record source over a local data directory:
 *
 * <pre>
 * datasets.json          [{"id":1,"name":"...","kind":"items|conversations"}, ...]
 * conversations.jsonl    one conversation with its messages per line
 * dataset-items.jsonl    one {"id","dataset_id","source_ref","data"} per line
 * </pre>
 *
 * Line files are streamed, never loaded whole, and must list records in ascending id order.
 */
public class LocalJsonlRecordSource implements RecordSource {
    public static final String DATASETS_FILE = "datasets.json";
    public static final String CONVERSATIONS_FILE = "conversations.jsonl";
    public static final String ITEMS_FILE = "dataset-items.jsonl";

    private final Path dataDir;
    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    public LocalJsonlRecordSource(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public Optional<Dataset> findDataset(long datasetId) throws IOException {
        Path catalog = dataDir.resolve(DATASETS_FILE);
        if (!Files.exists(catalog) || Files.size(catalog) == 0L) {
            return Optional.empty();
        }
        List<Dataset> datasets = objectMapper.readValue(catalog.toFile(), new TypeReference<List<Dataset>>() {
        });
        return datasets.stream()
                .filter(dataset -> dataset.id() == datasetId)
                .findFirst();
    }

    @Override
    public RecordCursor<Conversation> openConversations(ConversationFilter filter) throws IOException {
        return new JsonLinesCursor<>(
                dataDir.resolve(CONVERSATIONS_FILE),
                line -> objectMapper.readValue(line, Conversation.class),
                filter::matches,
                Conversation::id);
    }

    @Override
    public RecordCursor<DatasetItem> openItems(long datasetId) throws IOException {
        return new JsonLinesCursor<>(
                dataDir.resolve(ITEMS_FILE),
                this::readItem,
                item -> item.datasetId() == datasetId,
                DatasetItem::id);
    }

    DatasetItem readItem(String line) throws IOException {
        long id = 0L;
        long datasetId = 0L;
        String sourceRef = "";
        String data = null;
        try (JsonParser parser = objectMapper.createParser(line)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new JsonParseException(parser, "Expected a dataset item object");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                parser.nextToken();
                switch (field) {
                    case "id":
                        id = parser.getValueAsLong();
                        break;
                    case "dataset_id":
                        datasetId = parser.getValueAsLong();
                        break;
                    case "source_ref":
                        sourceRef = parser.getValueAsString("");
                        break;
                    case "data":
                        data = rawValue(line, parser);
                        break;
                    default:
                        parser.skipChildren();
                        break;
                }
            }
        }
        return new DatasetItem(id, datasetId, data, sourceRef);
    }

    // Slices the value's original text out of the line so items export can pass it through untouched.
    private static String rawValue(String line, JsonParser parser) throws IOException {
        int start = (int) parser.currentTokenLocation().getCharOffset();
        parser.finishToken();
        parser.skipChildren();
        int end = (int) parser.currentLocation().getCharOffset();
        if (start < 0 || end > line.length() || end <= start) {
            throw new JsonParseException(parser, "Unable to locate data value");
        }
        return line.substring(start, end);
    }
}
