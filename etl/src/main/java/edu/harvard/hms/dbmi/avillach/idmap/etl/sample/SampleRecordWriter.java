package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;

/**
 * Writes values in the framed layout read by {@link SampleRecordReader}.
 */
public class SampleRecordWriter implements Closeable {

    private final DataOutputStream out;
    private final ObjectMapper mapper;

    public SampleRecordWriter(Path path) throws IOException {
        this(open(path), SampleCorpusMapper.create());
    }

    public SampleRecordWriter(OutputStream out, ObjectMapper mapper) {
        this.out = new DataOutputStream(out);
        this.mapper = mapper;
    }

    private static OutputStream open(Path path) throws IOException {
        OutputStream raw = new BufferedOutputStream(Files.newOutputStream(path));
        if (path.getFileName().toString().endsWith(".gz")) {
            return new GZIPOutputStream(raw);
        }
        return raw;
    }

    /**
     * Serializes the value as JSON and appends it as one frame.
     */
    public void write(Object value) throws IOException {
        writeFrame(mapper.writeValueAsBytes(value));
    }

    public void writeFrame(byte[] payload) throws IOException {
        out.writeInt(payload.length);
        out.write(payload);
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
