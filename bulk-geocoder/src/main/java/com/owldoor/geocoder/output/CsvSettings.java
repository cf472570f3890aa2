package com.owldoor.geocoder.output;

import com.opencsv.ICSVParser;
import com.opencsv.RFC4180ParserBuilder;
import com.owldoor.geocoder.config.BulkGeocoderProperties;
import com.owldoor.geocoder.exception.ConfigurationException;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Delimiter and encoding, fixed for the whole run and shared by input and output.
 *
 * Both sides use the RFC 4180 dialect: quotes are escaped by doubling them and a backslash
 * is an ordinary character.
 */
public record CsvSettings(char delimiter, Charset charset) {

    public static final CsvSettings DEFAULT = new CsvSettings(',', StandardCharsets.UTF_8);

    public static CsvSettings from(BulkGeocoderProperties.Csv csv) {
        try {
            return new CsvSettings(csv.getDelimiter(), Charset.forName(csv.getCharset()));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigurationException("Unsupported charset: " + csv.getCharset(), e);
        }
    }

    public ICSVParser parser() {
        return new RFC4180ParserBuilder().withSeparator(delimiter).build();
    }
}
