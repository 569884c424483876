package com.example.leafmachine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "leafmachine")
public class LeafMachineProperties {

    private final Mas mas = new Mas();
    private final Inference inference = new Inference();
    private final Job job = new Job();
    private final Kafka kafka = new Kafka();
    private final LocalRun localRun = new LocalRun();

    public Mas getMas() {
        return mas;
    }

    public Inference getInference() {
        return inference;
    }

    public Job getJob() {
        return job;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public LocalRun getLocalRun() {
        return localRun;
    }

    /**
     * Identity of this machine annotation service, used to build the annotation creator.
     */
    public static class Mas {

        private String id = "leafmachine-demo";
        private String name = "LeafMachine plant component detection";

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static class Inference {

        private String endpoint = "https://herbaria.idlab.ugent.be/inference/process_image/";
        private String modelName = "leafpriority";
        private String modelReference = "https://github.com/kymillev/demo-enrichment-service-image";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public String getModelReference() {
            return modelReference;
        }

        public void setModelReference(String modelReference) {
            this.modelReference = modelReference;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Job {

        /**
         * Base URL of the job-tracking endpoint. When blank the running transition is only logged.
         */
        private String runningEndpoint;

        public String getRunningEndpoint() {
            return runningEndpoint;
        }

        public void setRunningEndpoint(String runningEndpoint) {
            this.runningEndpoint = runningEndpoint;
        }
    }

    public static class Kafka {

        private String consumerTopic = "leafmachine-demo";
        private String consumerGroup = "group";
        private String producerTopic = "annotation";
        private String failureTopic = "mas-failed";
        private Duration sendTimeout = Duration.ofSeconds(30);

        public String getConsumerTopic() {
            return consumerTopic;
        }

        public void setConsumerTopic(String consumerTopic) {
            this.consumerTopic = consumerTopic;
        }

        public String getConsumerGroup() {
            return consumerGroup;
        }

        public void setConsumerGroup(String consumerGroup) {
            this.consumerGroup = consumerGroup;
        }

        public String getProducerTopic() {
            return producerTopic;
        }

        public void setProducerTopic(String producerTopic) {
            this.producerTopic = producerTopic;
        }

        public String getFailureTopic() {
            return failureTopic;
        }

        public void setFailureTopic(String failureTopic) {
            this.failureTopic = failureTopic;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    public static class LocalRun {

        /**
         * Only digital media URLs under this base are fetched by the local-run endpoint.
         */
        private String apiBase = "https://sandbox.dissco.tech/api/";

        public String getApiBase() {
            return apiBase;
        }

        public void setApiBase(String apiBase) {
            this.apiBase = apiBase;
        }
    }
}
