package com.newsdigest.bot.config;

import com.newsdigest.bot.entity.SourceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * News digest configuration.
 *
 * Bound once at startup from application.yml and environment variables and not changed afterwards.
 */
@ConfigurationProperties(prefix = "digest")
@Validated
@Data
public class DigestProperties {

    @Valid
    private Schedule schedule = new Schedule();

    @Valid
    private List<Source> sources = new ArrayList<>();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Batch batch = new Batch();

    @Valid
    private RetrySettings retry = new RetrySettings();

    @Valid
    private Llm llm = new Llm();

    @Valid
    private Channel channel = new Channel();

    @Valid
    private Control control = new Control();

    @Valid
    private Admin admin = new Admin();

    @Data
    public static class Schedule {
        /**
         * Scheduled cycles are skipped while disabled (manual triggers still work)
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one cycle and the start of the next
         */
        @Min(1000)
        private long intervalMs = 1_800_000;

        @Min(0)
        private long initialDelayMs = 60_000;

        /**
         * Run one cycle right after startup reconciliation
         */
        private boolean runOnStartup = false;
    }

    @Data
    public static class Source {
        @NotBlank
        private String id;

        private String name;

        @NotNull
        private SourceType type = SourceType.RSS;

        @NotBlank
        private String url;

        private boolean active = true;

        /**
         * Keep only items whose title or content contains one of these (case-insensitive). Empty keeps all.
         */
        private List<String> keywords = new ArrayList<>();

        /**
         * Max items taken from one fetch
         */
        @Min(1)
        private int limit = 20;

        // WEBSITE selectors
        private String itemSelector = "article";
        private String linkSelector = "a[href]";
        private String titleSelector = "h1, h2, h3";
        private String summarySelector = "p";

        public String displayName() {
            return name != null && !name.isBlank() ? name : id;
        }
    }

    @Data
    public static class Fetch {
        @Min(1)
        private int poolSize = 4;

        @Min(1)
        private int timeoutSeconds = 30;

        private String userAgent = "Mozilla/5.0 (compatible; NewsDigestBot/1.0)";
    }

    @Data
    public static class Batch {
        @Min(1)
        private int maxItems = 10;

        @Min(200)
        private int maxChars = 12_000;

        /**
         * Item content is trimmed to this length before it goes into a prompt
         */
        @Min(100)
        private int maxItemChars = 1_500;
    }

    @Data
    public static class RetrySettings {
        @Valid
        private Retry llm = new Retry();

        @Valid
        private Retry channel = new Retry();
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long initialDelayMs = 1_000;

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @Min(0)
        private long maxDelayMs = 30_000;
    }

    @Data
    public static class Llm {
        @NotBlank
        private String baseUrl = "https://api.mistral.ai/v1";

        @NotBlank
        private String apiKey;

        @NotBlank
        private String model = "mistral-small-latest";

        @Min(1)
        private int timeoutSeconds = 60;

        @DecimalMin("0.0")
        private double temperature = 0.3;

        @Min(64)
        private int maxTokens = 2_000;

        @NotBlank
        private String systemPrompt = "You are a news editor. Write a short digest of the news items you are given.";

        @NotBlank
        private String instructions = "Summarize the following news items as one digest post. "
                + "Keep each item to one or two sentences and keep the order.";
    }

    @Data
    public static class Channel {
        @NotBlank
        private String apiBaseUrl = "https://api.telegram.org";

        @NotBlank
        private String botToken;

        @NotBlank
        private String chatId;

        private String parseMode = "HTML";

        private String header = "News digest";

        private boolean disableWebPagePreview = true;

        @Min(1)
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Control {
        /**
         * How long pause/resume wait for a running cycle before answering BUSY
         */
        @Min(0)
        private int lockTimeoutSeconds = 5;

        @Min(1)
        private int recentFailuresLimit = 20;
    }

    @Data
    public static class Admin {
        /**
         * JWT subject that is granted ROLE_ADMIN
         */
        @NotBlank
        private String userId;

        /**
         * HMAC-SHA key for admin tokens, at least 256 bits
         */
        @NotBlank
        @Size(min = 32)
        private String jwtSecret;
    }

    public List<Source> activeSources() {
        return sources.stream().filter(Source::isActive).toList();
    }
}
