package io.patchbay.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.patchbay.core.model.DelegationMode;
import java.io.IOException;
import java.io.Serial;

/// Serializes {@link DelegationMode} with a `"type"` discriminator.
///
/// ```
/// type        Additional fields
/// ————————————+——————————————————
/// delegated   │ target, method
/// direct      │ method
/// none        │ (none)
/// ```
///
/// @implNote Package-private. Registered by {@link PatchbayJacksonModule}.
/// @see DelegationModeDeserializer for the inverse operation
class DelegationModeSerializer extends StdSerializer<DelegationMode> {

    @Serial private static final long serialVersionUID = 3608214451309885124L;

    DelegationModeSerializer() {
        super(DelegationMode.class);
    }

    @Override
    public void serialize(DelegationMode mode, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        if (mode instanceof DelegationMode.Delegated delegated) {
            gen.writeStringField("type", "delegated");
            gen.writeStringField("target", delegated.target());
            gen.writeStringField("method", delegated.method());
        } else if (mode instanceof DelegationMode.Direct direct) {
            gen.writeStringField("type", "direct");
            gen.writeStringField("method", direct.method());
        } else {
            gen.writeStringField("type", "none");
        }
        gen.writeEndObject();
    }
}
