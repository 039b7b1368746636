package com.influxgate.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Omits null result members (absent aggregate, unknown field type) from every JSON response. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor influxGateObjectMapperCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
                    om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
                }
                return bean;
            }
        };
    }
}
