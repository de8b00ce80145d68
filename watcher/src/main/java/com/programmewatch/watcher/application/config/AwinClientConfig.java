package com.programmewatch.watcher.application.config;

import com.programmewatch.common.json.JacksonConfig;
import com.programmewatch.watcher.domain.programme.ProgrammeSource;
import com.programmewatch.watcher.infrastructure.awin.AwinProgrammeSource;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class AwinClientConfig {

    @Bean
    public RestClient awinRestClient(AwinProperties awin) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(awin.connectTimeout());
        requestFactory.setReadTimeout(awin.readTimeout());
        return RestClient.builder()
                .baseUrl(awin.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public ProgrammeSource programmeSource(RestClient awinRestClient, AwinProperties awin, Clock clock) {
        return new AwinProgrammeSource(awinRestClient, awin, JacksonConfig.createObjectMapper(), clock);
    }
}
