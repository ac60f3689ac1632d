package io.patchbay.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.patchbay.core.model.DelegationMode;
import java.io.Serial;

/// Jackson `SimpleModule` registering the custom handlers for the toolchain types.
///
/// - `DelegationMode`: `DelegationModeSerializer` / `DelegationModeDeserializer`,
///   discriminator `"type"`
///
/// Records (reports, verdicts, specs) need no registration.
///
/// @see ReportJsonWriter
/// @see ToolSpecReader
public class PatchbayJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5523087706198034410L;

    public PatchbayJacksonModule() {
        super("PatchbayJacksonModule");
        addSerializer(DelegationMode.class, new DelegationModeSerializer());
        addDeserializer(DelegationMode.class, new DelegationModeDeserializer());
    }
}
