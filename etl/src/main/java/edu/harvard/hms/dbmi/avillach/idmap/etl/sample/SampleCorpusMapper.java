package edu.harvard.hms.dbmi.avillach.idmap.etl.sample;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Jackson configuration shared by the sample corpus reader and writer.
 *
 * <p>Sample corpora exported from pandas carry bare {@code NaN} tokens for missing floats, so
 * non-numeric numbers are accepted on read and written unquoted. A frame must hold exactly one
 * JSON value; anything after it makes the frame undecodable.</p>
 */
public final class SampleCorpusMapper {

    private SampleCorpusMapper() {
    }

    public static ObjectMapper create() {
        return JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .build();
    }
}
