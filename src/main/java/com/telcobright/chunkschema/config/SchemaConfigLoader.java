package com.telcobright.chunkschema.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.telcobright.chunkschema.exception.SchemaConfigException;
import com.telcobright.chunkschema.schema.SchemaConfig;
import com.telcobright.chunkschema.time.DayTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Reads and writes schema configuration in YAML.
 *
 * <pre>{@code
 * configs:
 *   - from: "2020-07-31"
 *     store: boltdb-shipper
 *     object_store: gcs
 *     schema: v11
 *     index:
 *       prefix: loki_index_
 *       period: 24h
 * }</pre>
 *
 * Dates are {@code yyyy-MM-dd}; periods use {@link PeriodCodec}. The {@code load}
 * methods validate what they read and return the configuration with defaults applied.
 */
public class SchemaConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(SchemaConfigLoader.class);

    private final ObjectMapper mapper;

    public SchemaConfigLoader() {
        this(createMapper());
    }

    public SchemaConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * A YAML mapper that knows the compact period and date formats. Input streams
     * handed to it are left open.
     */
    public static ObjectMapper createMapper() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build();

        SimpleModule module = new SimpleModule("chunk-schema");
        module.addSerializer(Duration.class, new PeriodCodec.Serializer());
        module.addDeserializer(Duration.class, new PeriodCodec.Deserializer());
        module.addSerializer(DayTime.class, new DayTimeSerializer());
        module.addDeserializer(DayTime.class, new DayTimeDeserializer());

        return new ObjectMapper(factory).registerModule(module);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Read, validate and default a configuration file.
     *
     * @throws IOException           if the file cannot be read or is not valid YAML
     * @throws SchemaConfigException if the configuration breaks a schema rule
     */
    public SchemaConfig load(Path path) throws IOException, SchemaConfigException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    /**
     * Read, validate and default a configuration from a stream. The stream is not closed.
     */
    public SchemaConfig load(InputStream in, String sourceName) throws IOException, SchemaConfigException {
        return validate(mapper.readValue(in, SchemaConfig.class), sourceName);
    }

    /**
     * Read, validate and default a configuration held in a string.
     */
    public SchemaConfig loadString(String yaml) throws IOException, SchemaConfigException {
        return validate(read(yaml), "<string>");
    }

    /**
     * Read a configuration without validating it.
     */
    public SchemaConfig read(String yaml) throws IOException {
        return mapper.readValue(yaml, SchemaConfig.class);
    }

    /**
     * Render any configuration value (a whole schema, a period or a table config) as YAML.
     */
    public String writeYaml(Object value) throws IOException {
        return mapper.writeValueAsString(value);
    }

    private SchemaConfig validate(SchemaConfig config, String sourceName) throws SchemaConfigException {
        try {
            SchemaConfig validated = config.validate();
            logger.info("Loaded schema config from {} with {} period(s)", sourceName, validated.getConfigs().size());
            return validated;
        } catch (SchemaConfigException e) {
            logger.error("Rejected schema config from {}: {}", sourceName, e.getMessage());
            throw e;
        }
    }

    static class DayTimeSerializer extends JsonSerializer<DayTime> {
        @Override
        public void serialize(DayTime value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(value.format());
        }
    }

    static class DayTimeDeserializer extends JsonDeserializer<DayTime> {
        @Override
        public DayTime deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            try {
                return DayTime.parse(text);
            } catch (IllegalArgumentException e) {
                return (DayTime) context.handleWeirdStringValue(DayTime.class, text, e.getMessage());
            }
        }
    }
}
