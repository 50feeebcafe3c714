package com.dragnet.service.core.config;

import com.dragnet.core.datasource.DatasourceSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dragnet")
public class DragnetProperties {
    private Pipeline pipeline = new Pipeline();
    private Find find = new Find();
    private Index index = new Index();

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Find getFind() {
        return find;
    }

    public void setFind(Find find) {
        this.find = find;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    /** Settings handed to every datasource. */
    public DatasourceSettings toSettings() {
        return new DatasourceSettings(pipeline.getBufferSize(), find.getWorkers(), index.getUser());
    }

    public static class Pipeline {
        private int bufferSize = 64;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }
    }

    public static class Find {
        private int workers = 4;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }
    }

    public static class Index {
        private String user = "dragnet";

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }
    }
}
