package io.patchbay.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.patchbay.core.model.DelegationMode;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Deserializes {@link DelegationMode} from its `"type"` discriminator.
///
/// @implNote Package-private. Registered by {@link PatchbayJacksonModule}.
/// @see DelegationModeSerializer for the format
class DelegationModeDeserializer extends StdDeserializer<DelegationMode> {

    @Serial private static final long serialVersionUID = -1180935712086409245L;

    DelegationModeDeserializer() {
        super(DelegationMode.class);
    }

    @Override
    public DelegationMode deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        JsonNode root = p.getCodec().readTree(p);
        String type = text(root, "type");
        if (type == null) {
            throw ctxt.weirdStringException(
                    String.valueOf(root), DelegationMode.class, "mode needs a \"type\"");
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "delegated", "handler" -> {
                String target = text(root, "target");
                String method = text(root, "method");
                if (target == null || method == null) {
                    throw ctxt.weirdStringException(
                            String.valueOf(root),
                            DelegationMode.class,
                            "delegated mode needs \"target\" and \"method\"");
                }
                yield DelegationMode.delegated(target, method);
            }
            case "direct" -> {
                String method = text(root, "method");
                if (method == null) {
                    throw ctxt.weirdStringException(
                            String.valueOf(root), DelegationMode.class, "direct mode needs \"method\"");
                }
                yield DelegationMode.direct(method);
            }
            case "none" -> DelegationMode.none();
            default -> throw ctxt.weirdStringException(
                    type, DelegationMode.class, "unknown mode type");
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
