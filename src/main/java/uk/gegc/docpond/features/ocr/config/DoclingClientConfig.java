package uk.gegc.docpond.features.ocr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class DoclingClientConfig {

    @Bean("doclingRestClient")
    public RestClient doclingRestClient(OcrProperties properties) {
        OcrProperties.Docling docling = properties.getDocling();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(10_000);
        requestFactory.setReadTimeout((int) docling.getTimeout().toMillis());

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(docling.getBaseUrl())
                .requestFactory(requestFactory);
        if (StringUtils.hasText(docling.getApiKey())) {
            builder.defaultHeader("X-Api-Key", docling.getApiKey());
        }
        return builder.build();
    }
}
