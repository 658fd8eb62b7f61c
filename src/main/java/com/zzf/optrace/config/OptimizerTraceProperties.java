package com.zzf.optrace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "optrace.trace")
public class OptimizerTraceProperties {
    private String defaultFlags = "enabled=off,one_line=off";
    private String traceVariable = "optimizer_trace";
    private String systemViewSchema = "information_schema";
    private String systemViewName = "OPTIMIZER_TRACE";
    private String systemCharset = "UTF-8";

    public String getDefaultFlags() {
        return defaultFlags;
    }

    public void setDefaultFlags(String defaultFlags) {
        this.defaultFlags = defaultFlags;
    }

    public String getTraceVariable() {
        return traceVariable;
    }

    public void setTraceVariable(String traceVariable) {
        this.traceVariable = traceVariable;
    }

    public String getSystemViewSchema() {
        return systemViewSchema;
    }

    public void setSystemViewSchema(String systemViewSchema) {
        this.systemViewSchema = systemViewSchema;
    }

    public String getSystemViewName() {
        return systemViewName;
    }

    public void setSystemViewName(String systemViewName) {
        this.systemViewName = systemViewName;
    }

    public String getSystemCharset() {
        return systemCharset;
    }

    public void setSystemCharset(String systemCharset) {
        this.systemCharset = systemCharset;
    }
}
