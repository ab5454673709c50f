package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Sequential reader for sample corpus files.
 *
 * <p>A sample corpus is a series of frames, each a 4 byte big-endian length followed by that many
 * bytes of UTF-8 JSON. Files whose name ends in {@code .gz} are gunzipped on the fly.</p>
 *
 * <p>Running out of input exactly where the next length prefix would start is the normal end of the
 * corpus. Running out anywhere inside a frame means the file is truncated and is reported as an
 * {@link EOFException}.</p>
 */
public class SampleRecordReader implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SampleRecordReader.class);

    static final long MAX_FRAME_BYTES = 256L * 1024 * 1024;

    private final DataInputStream in;
    private final ObjectMapper mapper;
    private final String source;
    private long recordIndex = 0;

    public SampleRecordReader(Path path) throws IOException {
        this(open(path), SampleCorpusMapper.create(), path.toString());
    }

    public SampleRecordReader(InputStream in, ObjectMapper mapper, String source) {
        this.in = new DataInputStream(in);
        this.mapper = mapper;
        this.source = source;
    }

    private static InputStream open(Path path) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(path));
        if (!path.getFileName().toString().endsWith(".gz")) {
            return raw;
        }
        try {
            return new BufferedInputStream(new GZIPInputStream(raw));
        } catch (IOException | RuntimeException e) {
            try {
                raw.close();
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
    }

    /**
     * @return the next record, or empty once the corpus is exhausted
     * @throws IOException if the underlying stream fails or a frame is truncated
     */
    public Optional<SampleRecord> next() throws IOException {
        int first = in.read();
        if (first < 0) {
            return Optional.empty();
        }
        long length = ((long) first << 24) | readPrefixByte() << 16 | readPrefixByte() << 8 | readPrefixByte();
        if (length > MAX_FRAME_BYTES) {
            throw new IOException(
                "Frame " + recordIndex + " in " + source + " declares " + length + " bytes, more than the "
                    + MAX_FRAME_BYTES + " byte limit. The file is probably not a sample corpus."
            );
        }
        byte[] payload = new byte[(int) length];
        try {
            in.readFully(payload);
        } catch (EOFException e) {
            throw new EOFException("Sample corpus " + source + " is truncated inside frame " + recordIndex);
        }
        return Optional.of(decode(recordIndex++, payload));
    }

    private long readPrefixByte() throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new EOFException("Sample corpus " + source + " is truncated inside the length prefix of frame " + recordIndex);
        }
        return b;
    }

    private SampleRecord decode(long index, byte[] payload) {
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Frame {} in {} is not valid JSON: {}", index, source, e.getOriginalMessage());
            return SampleRecord.malformed(index, "undecodable", null);
        } catch (IOException e) {
            log.debug("Frame {} in {} could not be decoded", index, source, e);
            return SampleRecord.malformed(index, "undecodable", null);
        }
        if (node == null || node.isMissingNode()) {
            return SampleRecord.malformed(index, "empty", null);
        }
        if (!node.isObject()) {
            return SampleRecord.malformed(index, SampleValues.typeName(node), node);
        }
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), field.getValue());
        }
        return SampleRecord.structured(index, fields, node);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
