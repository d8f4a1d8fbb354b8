package com.datalab.pairs;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datalab.model.DatasetItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;

/**
 * Derives pairs from schema-free item JSON. Items that are not valid JSON, not an object, or of an
 * unrecognized shape contribute nothing; they are never an error.
 */
public class ItemPairDeriver {
    private static final Logger log = LoggerFactory.getLogger(ItemPairDeriver.class);

    private final PairDeriver pairDeriver;
    private final ObjectMapper objectMapper;

    public ItemPairDeriver() {
        this(new PairDeriver());
    }

    public ItemPairDeriver(PairDeriver pairDeriver) {
        this.pairDeriver = pairDeriver;
        this.objectMapper = strictMapper();
    }

    public List<ExportPair> derive(DatasetItem item, DerivationPolicy policy) {
        List<ExportPair> pairs = derive(item.data(), policy);
        if (pairs.isEmpty()) {
            log.debug("export.item.skipped itemId={} datasetId={} reason=no-derivable-pairs", item.id(), item.datasetId());
        }
        return pairs;
    }

    public List<ExportPair> derive(String itemData, DerivationPolicy policy) {
        return parse(itemData)
                .map(payload -> payload.derive(pairDeriver, policy))
                .orElse(List.of());
    }

    Optional<ItemPayload> parse(String itemData) {
        if (itemData == null || itemData.isBlank()) {
            return Optional.empty();
        }
        JsonNode data;
        try {
            data = objectMapper.readTree(itemData);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        return ItemPayload.parse(data, objectMapper);
    }

    // Message fields must be JSON strings; numbers or booleans make the whole messages array unusable.
    private static ObjectMapper strictMapper() {
        JsonMapper mapper = JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }
}
