package com.chatstore;

import com.chatstore.maintenance.DatabaseToolsRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Chat Store Application
 *
 * Reactive data-access layer for chat sessions, messages, text selections
 * and pgvector document embeddings. Launched directly it serves as the
 * entry point for the database maintenance tools.
 */
@SpringBootApplication
public class ChatStoreApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ChatStoreApplication.class, args);
        if (DatabaseToolsRunner.isToolInvocation(args)) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
