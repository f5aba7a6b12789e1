package com.trailledger.activity.config;

import com.trailledger.activity.service.EngineSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "trail-ledger")
@Data
public class TrailLedgerProperties {

    private Source source = new Source();
    private Store store = new Store();
    private Scheduling scheduling = new Scheduling();
    private Retry retry = new Retry();
    private Profile profile = new Profile();
    private Output output = new Output();

    @Data
    public static class Source {
        private String userName = "";
        private String password = "";

        @Override
        public String toString() {
            return "Source(userName=" + userName + ")";
        }
    }

    @Data
    public static class Store {
        private Backend backend = Backend.TABULAR;

        public enum Backend {
            TABULAR, GRAPH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 */6 * * *";
        private boolean runOnStartup = false;
        private boolean forceFutureRescan = false;
        /** Profiles scraped on each run in addition to the logged-in user */
        private List<String> profileUrls = new ArrayList<>();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration defaultDelay = Duration.ofSeconds(60);
        private Duration settleDelay = Duration.ofSeconds(20);
    }

    @Data
    public static class Profile {
        private Duration refreshInterval = EngineSettings.DEFAULT_PROFILE_REFRESH;
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }
    }

    public EngineSettings toEngineSettings() {
        return new EngineSettings(source.getUserName(), source.getPassword(), profile.getRefreshInterval());
    }
}
