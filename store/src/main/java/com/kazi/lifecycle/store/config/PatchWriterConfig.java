package com.kazi.lifecycle.store.config;

import com.kazi.lifecycle.common.lifecycle.ApplicationLifecycleService;
import com.kazi.lifecycle.common.lifecycle.ApplicationPatchWriter;
import com.kazi.lifecycle.store.ddb.DynamoApplicationPatchWriter;
import com.kazi.lifecycle.store.service.ApplicationTransitionService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Configuration
public class PatchWriterConfig {

    @Bean
    public ApplicationPatchWriter applicationPatchWriter(
            DynamoDbClient dynamoDbClient,
            @Value("${ddb.table-name}") String tableName
    ) {
        return new DynamoApplicationPatchWriter(dynamoDbClient, tableName);
    }

    @Bean
    public ApplicationTransitionService applicationTransitionService(
            ApplicationLifecycleService lifecycleService,
            ApplicationPatchWriter applicationPatchWriter
    ) {
        return new ApplicationTransitionService(lifecycleService, applicationPatchWriter);
    }
}
