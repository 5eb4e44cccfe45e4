package com.bko.plansolve.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "plansolve")
@Validated
public class PlanSolveProperties {

    @Valid
    private Pipeline pipeline = new Pipeline();
    @Valid
    private Session session = new Session();
    @Valid
    private Connection connection = new Connection();
    @Valid
    private State state = new State();
    @Valid
    private Llm llm = new Llm();

    public static class Pipeline {
        private int concurrency = 5;
        private int maxRetry = 1;
        private Duration retryDelay = Duration.ofSeconds(3);
        private double backoffMultiplier = 1.0;
        private Duration maxRetryDelay = Duration.ofSeconds(30);
        private Duration attemptTimeout = Duration.ofMinutes(10);
        private Duration cancelGrace = Duration.ofSeconds(5);
        private boolean requireConfirmation = true;
        private Duration confirmationTimeout = Duration.ofSeconds(300);
        @Min(1)
        private int workerThreads = 16;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            if (concurrency < 1) {
                return;
            }
            this.concurrency = concurrency;
        }

        public int getMaxRetry() {
            return maxRetry;
        }

        public void setMaxRetry(int maxRetry) {
            this.maxRetry = Math.max(0, maxRetry);
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier < 1.0 ? 1.0 : backoffMultiplier;
        }

        public Duration getMaxRetryDelay() {
            return maxRetryDelay;
        }

        public void setMaxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
        }

        public Duration getAttemptTimeout() {
            return attemptTimeout;
        }

        public void setAttemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
        }

        public Duration getCancelGrace() {
            return cancelGrace;
        }

        public void setCancelGrace(Duration cancelGrace) {
            this.cancelGrace = cancelGrace;
        }

        public boolean isRequireConfirmation() {
            return requireConfirmation;
        }

        public void setRequireConfirmation(boolean requireConfirmation) {
            this.requireConfirmation = requireConfirmation;
        }

        public Duration getConfirmationTimeout() {
            return confirmationTimeout;
        }

        public void setConfirmationTimeout(Duration confirmationTimeout) {
            this.confirmationTimeout = confirmationTimeout;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Session {
        private Duration idleTimeout = Duration.ofMinutes(30);
        private int replayCapacity = 0;
        private Duration evictionInterval = Duration.ofSeconds(60);

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        /**
         * Maximum number of unacknowledged events kept per session; {@code 0} keeps everything.
         */
        public int getReplayCapacity() {
            return replayCapacity;
        }

        public void setReplayCapacity(int replayCapacity) {
            this.replayCapacity = Math.max(0, replayCapacity);
        }

        public Duration getEvictionInterval() {
            return evictionInterval;
        }

        public void setEvictionInterval(Duration evictionInterval) {
            this.evictionInterval = evictionInterval;
        }
    }

    public static class Connection {
        @NotBlank
        private String path = "/ws/pipeline";
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration livenessTimeout = Duration.ofSeconds(90);

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getLivenessTimeout() {
            return livenessTimeout;
        }

        public void setLivenessTimeout(Duration livenessTimeout) {
            this.livenessTimeout = livenessTimeout;
        }
    }

    public static class State {
        @NotBlank
        private String secret;
        private Duration ttl = Duration.ofDays(7);
        @NotBlank
        private String version = "1.0";

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }

    public static class Llm {
        @Min(1)
        private int maxTasks = 6;

        public int getMaxTasks() {
            return maxTasks;
        }

        public void setMaxTasks(int maxTasks) {
            this.maxTasks = maxTasks;
        }
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline != null ? pipeline : new Pipeline();
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session != null ? session : new Session();
    }

    public Connection getConnection() {
        return connection;
    }

    public void setConnection(Connection connection) {
        this.connection = connection != null ? connection : new Connection();
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state != null ? state : new State();
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm != null ? llm : new Llm();
    }
}
