package info.isaksson.erland.xamlmigrate.mapping;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON reading and writing of {@link MappingDatabase} documents.
 *
 * <p>Property names are matched case-insensitively and unknown properties are ignored, so mapping files
 * written for newer versions still load.</p>
 */
public final class MappingJson {

    /** Classpath location of the bundled default mappings. */
    public static final String DEFAULT_RESOURCE = "info/isaksson/erland/xamlmigrate/mapping/default-mappings.json";

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private MappingJson() {}

    public static MappingDatabase read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, MappingDatabase.class);
        }
    }

    public static MappingDatabase read(InputStream in) throws IOException {
        if (in == null) throw new IllegalArgumentException("in is null");
        return MAPPER.readValue(in, MappingDatabase.class);
    }

    public static MappingDatabase readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, MappingDatabase.class);
    }

    /** Read a database from the classpath of this module. */
    public static MappingDatabase readResource(String resource) throws IOException {
        if (resource == null) throw new IllegalArgumentException("resource is null");
        ClassLoader cl = MappingJson.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new FileNotFoundException("classpath resource not found: " + resource);
            return MAPPER.readValue(in, MappingDatabase.class);
        }
    }

    public static MappingRepository loadRepository(Path path) throws IOException {
        return new DefaultMappingRepository(read(path));
    }

    /** Repository over the bundled default source-to-target mappings. */
    public static MappingRepository loadDefaults() throws IOException {
        return new DefaultMappingRepository(readResource(DEFAULT_RESOURCE));
    }

    public static void write(MappingDatabase database, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, database);
            out.write('\n');
        }
    }

    public static String toJsonString(MappingDatabase database) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(database) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .build();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
