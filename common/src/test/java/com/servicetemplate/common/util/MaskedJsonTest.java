package com.servicetemplate.common.util;

import static org.assertj.core.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import com.servicetemplate.common.config.ConfigSource;
import com.servicetemplate.common.config.ServiceConfig;

@DisplayName("Masked JSON")
class MaskedJsonTest {

    static class BaseSettings {
        @SerializedName("SERVICE_NAME")
        String serviceName = "orders";

        @Sensitive
        @SerializedName("API_KEY")
        String apiKey = "abcdefgh12";

        static String ignoredStatic = "static";
    }

    static class ChildSettings extends BaseSettings {
        @SerializedName("TEST")
        String test = "value";

        @Sensitive
        String token = "short";

        int retries = 3;

        List<String> tags = List.of("a", "b");

        transient String cache = "skip";
    }

    @Test
    @DisplayName("Long secrets keep two characters at each end, short ones are fully masked")
    void testMask() {
        assertThat(MaskedJson.mask("abcdefgh")).isEqualTo("ab****gh");
        assertThat(MaskedJson.mask("abcdefg")).isEqualTo("****");
        assertThat(MaskedJson.mask("")).isEqualTo("****");
        assertThat(MaskedJson.mask(null)).isEqualTo("****");
    }

    @Test
    @DisplayName("Inherited fields are flattened and sensitive ones masked")
    void testFlattenAndMask() {
        JsonObject json = JsonParser.parseString(MaskedJson.toJson(new ChildSettings())).getAsJsonObject();

        assertThat(json.get("SERVICE_NAME").getAsString()).isEqualTo("orders");
        assertThat(json.get("API_KEY").getAsString()).isEqualTo("ab****12");
        assertThat(json.get("TEST").getAsString()).isEqualTo("value");
        assertThat(json.get("token").getAsString()).isEqualTo("****");
        assertThat(json.get("retries").getAsInt()).isEqualTo(3);
        assertThat(json.get("tags").getAsJsonArray()).hasSize(2);
        assertThat(json.has("cache")).isFalse();
        assertThat(json.has("ignoredStatic")).isFalse();
    }

    @Test
    @DisplayName("Service configuration renders with its broker section nested and passwords masked")
    void testServiceConfig() {
        Map<String, String> env = new HashMap<>();
        env.put("API_KEY", "super-secret-key");
        env.put("MQ_QUEUE", "orders");
        env.put("MQ_PASSWORD", "guest");
        ServiceConfig config = ServiceConfig.from(new ConfigSource(env, null, null, null));

        JsonObject json = JsonParser.parseString(MaskedJson.toJson(config)).getAsJsonObject();

        assertThat(json.get("API_KEY").getAsString()).isEqualTo("su****ey");
        assertThat(json.get("SERVICE_NAME").getAsString()).isEqualTo("servicetemplate");
        assertThat(json.getAsJsonObject("MQ").get("MQ_PASSWORD").getAsString()).isEqualTo("****");
        assertThat(json.getAsJsonObject("MQ").get("MQ_QUEUE").getAsString()).isEqualTo("orders");
        assertThat(json.has("source")).isFalse();
    }

    @Test
    @DisplayName("Null renders as an empty object")
    void testNull() {
        assertThat(MaskedJson.toJson(null)).isEqualTo("{}");
    }
}
