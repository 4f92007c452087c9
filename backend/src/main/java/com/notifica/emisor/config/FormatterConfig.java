package com.notifica.emisor.config;

import com.notifica.emisor.util.FormatSettings;
import com.notifica.emisor.util.TextFormatter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class FormatterConfig {

    @Bean
    public FormatSettings formatSettings(@Value("${emisor.format.currency-symbol:$}") String currencySymbol,
                                         @Value("${emisor.format.thousands-separator:.}") String thousandsSeparator,
                                         @Value("${emisor.format.decimal-separator:,}") String decimalSeparator,
                                         @Value("${emisor.format.date-pattern:dd/MM/yyyy}") String datePattern) {
        return new FormatSettings(currencySymbol, firstChar(thousandsSeparator, '.'), firstChar(decimalSeparator, ','), datePattern);
    }

    @Bean
    public TextFormatter textFormatter(FormatSettings formatSettings) {
        return new TextFormatter(formatSettings);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private static char firstChar(String s, char fallback) {
        return s == null || s.isEmpty() ? fallback : s.charAt(0);
    }
}
