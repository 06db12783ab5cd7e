package com.tendersearch.config;

import com.tendersearch.search.model.DuplicatePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "tender-search")
public class SearchProperties {
    private static final String DEFAULT_USER_AGENT = "public-tender-search/0.1 (+contact)";

    private String userAgent;
    private int globalConcurrency = 4;
    private int requestTimeoutSeconds = 30;
    private int sourceTimeoutSeconds = 120;
    private int defaultLookbackDays = 30;
    private List<String> defaultSources = new ArrayList<>(List.of("ted", "openopps", "sam", "contracts_finder"));
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.FIRST_SEEN;
    private Ted ted = new Ted();
    private Sam sam = new Sam();
    private OpenOpps openopps = new OpenOpps();
    private ContractsFinder contractsFinder = new ContractsFinder();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getSourceTimeoutSeconds() {
        return Math.max(1, sourceTimeoutSeconds);
    }

    public void setSourceTimeoutSeconds(int sourceTimeoutSeconds) {
        this.sourceTimeoutSeconds = sourceTimeoutSeconds;
    }

    public int getDefaultLookbackDays() {
        return Math.max(0, defaultLookbackDays);
    }

    public void setDefaultLookbackDays(int defaultLookbackDays) {
        this.defaultLookbackDays = defaultLookbackDays;
    }

    public List<String> getDefaultSources() {
        return defaultSources;
    }

    public void setDefaultSources(List<String> defaultSources) {
        this.defaultSources = defaultSources == null ? new ArrayList<>() : defaultSources;
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy == null ? DuplicatePolicy.FIRST_SEEN : duplicatePolicy;
    }

    public void setDuplicatePolicy(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = duplicatePolicy;
    }

    public Ted getTed() {
        return ted;
    }

    public void setTed(Ted ted) {
        this.ted = ted;
    }

    public Sam getSam() {
        return sam;
    }

    public void setSam(Sam sam) {
        this.sam = sam;
    }

    public OpenOpps getOpenopps() {
        return openopps;
    }

    public void setOpenopps(OpenOpps openopps) {
        this.openopps = openopps;
    }

    public ContractsFinder getContractsFinder() {
        return contractsFinder;
    }

    public void setContractsFinder(ContractsFinder contractsFinder) {
        this.contractsFinder = contractsFinder;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static int clampPageSize(int pageSize) {
        return Math.max(1, Math.min(1000, pageSize));
    }

    public static class Ted {
        private String baseUrl = "https://ted.europa.eu/api/v3.0";
        private String apiKey;
        private int pageSize = 100;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getPageSize() {
            return clampPageSize(pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Sam {
        private String baseUrl = "https://api.sam.gov/prod/opportunities/v2/search";
        private String apiKey;
        private int pageSize = 100;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getPageSize() {
            return clampPageSize(pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class OpenOpps {
        private String baseUrl = "https://api.openopps.com/api";
        private String username;
        private String password;
        private int pageSize = 100;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getPageSize() {
            return clampPageSize(pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class ContractsFinder {
        private String baseUrl = "https://www.contractsfinder.service.gov.uk/api/rest/2";
        private int pageSize = 100;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getPageSize() {
            return clampPageSize(pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Output {
        private String directory = "results";
        private boolean writeJson = true;
        private boolean writeCsv = true;

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "results" : directory.trim();
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isWriteJson() {
            return writeJson;
        }

        public void setWriteJson(boolean writeJson) {
            this.writeJson = writeJson;
        }

        public boolean isWriteCsv() {
            return writeCsv;
        }

        public void setWriteCsv(boolean writeCsv) {
            this.writeCsv = writeCsv;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String searchTerm = "";
        private String sources = "";
        private String dateFrom = "";
        private String dateTo = "";
        private int minValue = 0;
        private boolean export = true;
        private boolean exitAfterRun = false;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSearchTerm() {
            return searchTerm;
        }

        public void setSearchTerm(String searchTerm) {
            this.searchTerm = searchTerm;
        }

        public String getSources() {
            return sources;
        }

        public void setSources(String sources) {
            this.sources = sources;
        }

        public String getDateFrom() {
            return dateFrom;
        }

        public void setDateFrom(String dateFrom) {
            this.dateFrom = dateFrom;
        }

        public String getDateTo() {
            return dateTo;
        }

        public void setDateTo(String dateTo) {
            this.dateTo = dateTo;
        }

        public int getMinValue() {
            return minValue;
        }

        public void setMinValue(int minValue) {
            this.minValue = minValue;
        }

        public boolean isExport() {
            return export;
        }

        public void setExport(boolean export) {
            this.export = export;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
