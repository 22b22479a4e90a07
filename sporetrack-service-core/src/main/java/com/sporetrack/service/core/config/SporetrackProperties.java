package com.sporetrack.service.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sporetrack")
public class SporetrackProperties {
    private Pipeline pipeline = new Pipeline();
    private Sync sync = new Sync();
    private Partitions partitions = new Partitions();
    private Schema schema = new Schema();

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Sync getSync() {
        return sync;
    }

    public void setSync(Sync sync) {
        this.sync = sync;
    }

    public Partitions getPartitions() {
        return partitions;
    }

    public void setPartitions(Partitions partitions) {
        this.partitions = partitions;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    public static class Pipeline {
        /** Zone in which capture timestamps are turned into calendar days. */
        private String zone = "UTC";

        private double maxMaterial = 15.0;
        private double benchmarkRate = 1.0714;

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public double getMaxMaterial() {
            return maxMaterial;
        }

        public void setMaxMaterial(double maxMaterial) {
            this.maxMaterial = maxMaterial;
        }

        public double getBenchmarkRate() {
            return benchmarkRate;
        }

        public void setBenchmarkRate(double benchmarkRate) {
            this.benchmarkRate = benchmarkRate;
        }
    }

    public static class Sync {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private int resyncBatchSize = 500;
        private Duration lagWarningThreshold = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public int getResyncBatchSize() {
            return resyncBatchSize;
        }

        public void setResyncBatchSize(int resyncBatchSize) {
            this.resyncBatchSize = resyncBatchSize;
        }

        public Duration getLagWarningThreshold() {
            return lagWarningThreshold;
        }

        public void setLagWarningThreshold(Duration lagWarningThreshold) {
            this.lagWarningThreshold = lagWarningThreshold;
        }
    }

    public static class Partitions {
        private int provisioningWorkers = 1;
        private int provisioningQueueCapacity = 1000;
        private Duration retention = Duration.ofDays(30);
        private int reconcileBatchSize = 1000;

        public int getProvisioningWorkers() {
            return provisioningWorkers;
        }

        public void setProvisioningWorkers(int provisioningWorkers) {
            this.provisioningWorkers = provisioningWorkers;
        }

        public int getProvisioningQueueCapacity() {
            return provisioningQueueCapacity;
        }

        public void setProvisioningQueueCapacity(int provisioningQueueCapacity) {
            this.provisioningQueueCapacity = provisioningQueueCapacity;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getReconcileBatchSize() {
            return reconcileBatchSize;
        }

        public void setReconcileBatchSize(int reconcileBatchSize) {
            this.reconcileBatchSize = reconcileBatchSize;
        }
    }

    public static class Schema {
        private int version = 1;
        /** Empty means the built-in column set of the configured version. */
        private List<Column> columns = new ArrayList<>();

        public int getVersion() {
            return version;
        }

        public void setVersion(int version) {
            this.version = version;
        }

        public List<Column> getColumns() {
            return columns;
        }

        public void setColumns(List<Column> columns) {
            this.columns = columns;
        }
    }

    public static class Column {
        private String name;
        private String type;
        private boolean derived;

        public Column() {}

        public Column(String name, String type, boolean derived) {
            this.name = name;
            this.type = type;
            this.derived = derived;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isDerived() {
            return derived;
        }

        public void setDerived(boolean derived) {
            this.derived = derived;
        }
    }
}
