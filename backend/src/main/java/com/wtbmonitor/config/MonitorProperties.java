package com.wtbmonitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "wtb-monitor")
public class MonitorProperties {
    private static final List<String> DEFAULT_FILLER_WORDS = List.of("the", "new", "mens", "womens", "men's", "women's");

    private Matching matching = new Matching();
    private Ingestion ingestion = new Ingestion();
    private Scraper scraper = new Scraper();
    private Console console = new Console();
    private Api api = new Api();
    private Stores stores = new Stores();

    public Matching getMatching() {
        return matching;
    }

    public void setMatching(Matching matching) {
        this.matching = matching;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public Console getConsole() {
        return console;
    }

    public void setConsole(Console console) {
        this.console = console;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Stores getStores() {
        return stores;
    }

    public void setStores(Stores stores) {
        this.stores = stores;
    }

    public static class Matching {
        private double similarityThreshold = 0.75;
        private double brandBonus = 0.1;
        private List<String> fillerWords = new ArrayList<>(DEFAULT_FILLER_WORDS);

        public double getSimilarityThreshold() {
            return Math.min(1.0, Math.max(0.0, similarityThreshold));
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public double getBrandBonus() {
            return Math.max(0.0, brandBonus);
        }

        public void setBrandBonus(double brandBonus) {
            this.brandBonus = brandBonus;
        }

        public List<String> getFillerWords() {
            return fillerWords == null ? List.of() : fillerWords;
        }

        public void setFillerWords(List<String> fillerWords) {
            this.fillerWords = fillerWords;
        }
    }

    public static class Ingestion {
        private int batchSize = 500;
        private int staleSessionMinutes = 120;
        private int maxErrorSamples = 10;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getStaleSessionMinutes() {
            return Math.max(1, staleSessionMinutes);
        }

        public void setStaleSessionMinutes(int staleSessionMinutes) {
            this.staleSessionMinutes = Math.max(1, staleSessionMinutes);
        }

        public int getMaxErrorSamples() {
            return Math.max(0, maxErrorSamples);
        }

        public void setMaxErrorSamples(int maxErrorSamples) {
            this.maxErrorSamples = Math.max(0, maxErrorSamples);
        }
    }

    public static class Scraper {
        private Command wtb = new Command();
        private Command inventory = new Command();
        private int progressDrainSeconds = 5;

        public Command getWtb() {
            return wtb;
        }

        public void setWtb(Command wtb) {
            this.wtb = wtb;
        }

        public Command getInventory() {
            return inventory;
        }

        public void setInventory(Command inventory) {
            this.inventory = inventory;
        }

        public int getProgressDrainSeconds() {
            return Math.max(1, progressDrainSeconds);
        }

        public void setProgressDrainSeconds(int progressDrainSeconds) {
            this.progressDrainSeconds = Math.max(1, progressDrainSeconds);
        }
    }

    /**
     * External scraper invocation. An empty command leaves the source unavailable.
     */
    public static class Command {
        private List<String> command = new ArrayList<>();
        private String workingDir = ".";
        private int timeoutSeconds = 600;
        private String originLabel;
        private String targetsFile;

        public List<String> getCommand() {
            return command == null ? List.of() : command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public String getWorkingDir() {
            return workingDir == null || workingDir.isBlank() ? "." : workingDir.trim();
        }

        public void setWorkingDir(String workingDir) {
            this.workingDir = workingDir;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public String getOriginLabel() {
            return originLabel;
        }

        public void setOriginLabel(String originLabel) {
            this.originLabel = originLabel;
        }

        /**
         * File, relative to the working directory, that receives the enabled store targets before each run.
         * Blank means the command takes no targets.
         */
        public String getTargetsFile() {
            return targetsFile == null || targetsFile.isBlank() ? null : targetsFile.trim();
        }

        public void setTargetsFile(String targetsFile) {
            this.targetsFile = targetsFile;
        }
    }

    public static class Console {
        private int capacity = 200;

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }
    }

    public static class Api {
        private int defaultSessionLimit = 50;
        private int maxSessionLimit = 500;
        private int defaultOpportunityLimit = 20;

        public int getDefaultSessionLimit() {
            return Math.max(1, defaultSessionLimit);
        }

        public void setDefaultSessionLimit(int defaultSessionLimit) {
            this.defaultSessionLimit = Math.max(1, defaultSessionLimit);
        }

        public int getMaxSessionLimit() {
            return Math.max(1, maxSessionLimit);
        }

        public void setMaxSessionLimit(int maxSessionLimit) {
            this.maxSessionLimit = Math.max(1, maxSessionLimit);
        }

        public int getDefaultOpportunityLimit() {
            return Math.max(1, defaultOpportunityLimit);
        }

        public void setDefaultOpportunityLimit(int defaultOpportunityLimit) {
            this.defaultOpportunityLimit = Math.max(1, defaultOpportunityLimit);
        }
    }

    public static class Stores {
        private String urlPrefix = "https://www.wtbmarketlist.eu/store/";

        public String getUrlPrefix() {
            return urlPrefix == null ? "" : urlPrefix.trim();
        }

        public void setUrlPrefix(String urlPrefix) {
            this.urlPrefix = urlPrefix;
        }
    }
}
