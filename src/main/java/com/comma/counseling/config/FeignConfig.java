package com.comma.counseling.config;

import com.comma.counseling.client.ServiceAuthClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.RequestInterceptor;
import feign.codec.Decoder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StreamUtils;

import java.nio.charset.StandardCharsets;

@Configuration
public class FeignConfig {

    @Bean
    public RequestInterceptor serviceAuthInterceptor(ServiceAuthClient authClient,
                                                     @Value("${identity.audience:identity}") String audience) {
        return template -> template.header(HttpHeaders.AUTHORIZATION, "Bearer " + authClient.createToken(audience));
    }

    @Bean
    public Decoder feignDecoder(ObjectMapper mapper) {
        return (response, type) -> {
            if (response.body() == null) {
                return null;
            }
            String body = StreamUtils.copyToString(response.body().asInputStream(), StandardCharsets.UTF_8);
            return mapper.readValue(body, mapper.constructType(type));
        };
    }
}
