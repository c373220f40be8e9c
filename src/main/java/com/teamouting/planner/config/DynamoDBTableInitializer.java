package com.teamouting.planner.config;

import com.teamouting.planner.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the OutingTable on startup when it does not exist yet (local development and test stacks).
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);
    private static final String TABLE_NAME = "OutingTable";

    @Autowired
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Override
    public void run(ApplicationArguments args) {
        DynamoDbTable<Event> table = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(Event.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", TABLE_NAME);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", TABLE_NAME);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(ProvisionedThroughput.builder()
                    .readCapacityUnits(5L)
                    .writeCapacityUnits(5L)
                    .build())
                .build());
            logger.info("Table {} created successfully", TABLE_NAME);
        }
    }
}
