package com.smurthy.ai.chatrouter;

import com.smurthy.ai.chatrouter.config.ContextConfig;
import com.smurthy.ai.chatrouter.config.ConversationConfig;
import com.smurthy.ai.chatrouter.config.GenerationConfig;
import com.smurthy.ai.chatrouter.config.RetrievalConfig;
import com.smurthy.ai.chatrouter.config.RoutingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
		ConversationConfig.class,
		RetrievalConfig.class,
		ContextConfig.class,
		GenerationConfig.class,
		RoutingConfig.class
})
public class ChatRouterApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChatRouterApplication.class, args);
	}

}
