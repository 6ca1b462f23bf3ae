package com.chatstore.config;

import jakarta.validation.Validator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.beanvalidation.MethodValidationPostProcessor;

/**
 * Method validation for {@code @Validated} services.
 *
 * The validation advisor is placed ahead of the transaction advisor, so an
 * invalid argument is rejected before a connection is acquired for the
 * transaction.
 */
@Configuration
public class ValidationConfig {

    @Bean
    public static MethodValidationPostProcessor methodValidationPostProcessor(ObjectProvider<Validator> validator) {
        MethodValidationPostProcessor processor = new MethodValidationPostProcessor();
        processor.setProxyTargetClass(true);
        processor.setBeforeExistingAdvisors(true);
        processor.setValidatorProvider(validator);
        return processor;
    }
}
