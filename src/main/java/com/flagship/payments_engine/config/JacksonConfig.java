package com.flagship.payments_engine.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for CSV input and output.
 *
 * A single {@link CsvMapper} is shared by the transaction reader and the snapshot writer;
 * each derives its own immutable reader/writer with the features it needs.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }
}
