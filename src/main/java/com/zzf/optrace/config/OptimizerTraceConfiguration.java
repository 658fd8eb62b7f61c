package com.zzf.optrace.config;

import com.zzf.optrace.service.PrivilegeChecker;
import com.zzf.optrace.trace.gate.CommandClassifier;
import com.zzf.optrace.trace.gate.DefaultCommandClassifier;
import com.zzf.optrace.trace.gate.TraceGate;
import com.zzf.optrace.trace.view.CharsetConverter;
import com.zzf.optrace.trace.view.JdkCharsetConverter;
import com.zzf.optrace.trace.view.OptimizerTraceView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

@Configuration
public class OptimizerTraceConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(OptimizerTraceConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CommandClassifier commandClassifier(OptimizerTraceProperties properties) {
        return new DefaultCommandClassifier(properties.getTraceVariable());
    }

    @Bean
    public TraceGate traceGate(CommandClassifier classifier, OptimizerTraceProperties properties) {
        logger.info("trace.gate view={}.{} variable={}", properties.getSystemViewSchema(), properties.getSystemViewName(), properties.getTraceVariable());
        return new TraceGate(classifier, properties.getSystemViewSchema(), properties.getSystemViewName());
    }

    @Bean
    @ConditionalOnMissingBean
    public CharsetConverter charsetConverter() {
        return new JdkCharsetConverter();
    }

    @Bean
    public OptimizerTraceView optimizerTraceView(CharsetConverter converter, OptimizerTraceProperties properties) {
        return new OptimizerTraceView(converter, systemCharset(properties.getSystemCharset()));
    }

    // the host engine replaces this with its grant tables
    @Bean
    @ConditionalOnMissingBean
    public PrivilegeChecker privilegeChecker() {
        return (session, trace) -> true;
    }

    private static Charset systemCharset(String name) {
        if (name == null || name.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name.trim());
        } catch (IllegalArgumentException e) {
            logger.warn("trace.charset.invalid name={} fallback=UTF-8 err={}", name, e.toString());
            return StandardCharsets.UTF_8;
        }
    }
}
