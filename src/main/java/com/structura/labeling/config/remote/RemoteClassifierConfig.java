package com.structura.labeling.config.remote;

import com.structura.labeling.service.metrics.ClassificationMetrics;
import com.structura.labeling.service.remote.ClassificationPayloadCodec;
import com.structura.labeling.service.remote.ClassifierTransport;
import com.structura.labeling.service.remote.HttpClassifierTransport;
import com.structura.labeling.service.remote.RemoteClassifierClient;
import com.structura.labeling.service.remote.RetryPolicy;
import com.structura.labeling.service.remote.Sleeper;
import com.structura.labeling.service.remote.TimeoutPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Wires the remote classifier from {@link RemoteClassifierProperties}.
 * Test configurations can provide alternative transports or sleepers by marking them as @Primary.
 */
@Configuration
public class RemoteClassifierConfig {

    private static final Logger LOG = LogManager.getLogger(RemoteClassifierConfig.class);

    private final RemoteClassifierProperties props;

    public RemoteClassifierConfig(RemoteClassifierProperties props) {
        this.props = props;
    }

    @Bean
    public TimeoutPolicy timeoutPolicy() {
        return new TimeoutPolicy(props.baseTimeout(), props.perParagraphTimeout(), props.maxTimeout());
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(props.getMaxRetryAttempts(), props.backoffBase());
    }

    @Bean
    public HttpClient classifierHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(props.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public ClassifierTransport classifierTransport(HttpClient classifierHttpClient) {
        if (!props.hasApiKey()) {
            LOG.warn("structura.remote.api-key is not set; remote and hybrid labeling will fall back to rules");
        }
        return new HttpClassifierTransport(classifierHttpClient, props.getBaseUrl(), props.getApiKey());
    }

    @Bean
    public ClassificationPayloadCodec classificationPayloadCodec() {
        return new ClassificationPayloadCodec(props.getModel(), props.getTemperature());
    }

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public RemoteClassifierClient remoteClassifierClient(ClassifierTransport transport,
                                                         ClassificationPayloadCodec codec,
                                                         TimeoutPolicy timeoutPolicy,
                                                         RetryPolicy retryPolicy,
                                                         Sleeper sleeper,
                                                         ClassificationMetrics metrics) {
        LOG.info("Remote classifier configured: {}", props);
        return new RemoteClassifierClient(transport, codec, timeoutPolicy, retryPolicy, sleeper, metrics);
    }
}
