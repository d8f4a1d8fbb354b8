package com.datalab.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.datalab.export.ExportOptions;
import com.datalab.export.ExportType;
import com.datalab.pairs.ContextMode;
import com.datalab.pairs.DerivationPolicy;
import com.datalab.pairs.RoleStyle;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    public static final String DATA_DIR_ENV = "DATALAB_DATA_DIR";

    private StoreConfig store = new StoreConfig();
    private ExportDefaults export = new ExportDefaults();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public ExportDefaults getExport() {
        return export;
    }

    public void setExport(ExportDefaults export) {
        this.export = export == null ? new ExportDefaults() : export;
    }

    /**
     * Loads YAML config; a missing file yields the built-in defaults.
     */
    public static AppConfig load(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }

    /**
     * Applies environment overrides, which win over file values.
     */
    public AppConfig withEnvironment(Map<String, String> environment) {
        String dataDir = environment.get(DATA_DIR_ENV);
        if (dataDir != null && !dataDir.isBlank()) {
            store.setDataDir(dataDir.strip());
        }
        return this;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String dataDir = ".datalab";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExportDefaults {
        private String type = ExportType.PAIRS.value();
        private String split = ExportOptions.DEFAULT_SPLIT;
        private String status = ExportOptions.DEFAULT_STATUS;
        private String context = ContextMode.NONE.value();
        private int contextTurns = DerivationPolicy.DEFAULT_CONTEXT_TURNS;
        private String roleStyle = RoleStyle.LABELS.value();
        private boolean includeSystem;
        private int maxExamples;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getSplit() {
            return split;
        }

        public void setSplit(String split) {
            this.split = split;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public String getContext() {
            return context;
        }

        public void setContext(String context) {
            this.context = context;
        }

        public int getContextTurns() {
            return contextTurns;
        }

        public void setContextTurns(int contextTurns) {
            this.contextTurns = contextTurns;
        }

        public String getRoleStyle() {
            return roleStyle;
        }

        public void setRoleStyle(String roleStyle) {
            this.roleStyle = roleStyle;
        }

        public boolean isIncludeSystem() {
            return includeSystem;
        }

        public void setIncludeSystem(boolean includeSystem) {
            this.includeSystem = includeSystem;
        }

        public int getMaxExamples() {
            return maxExamples;
        }

        public void setMaxExamples(int maxExamples) {
            this.maxExamples = maxExamples;
        }
    }
}
