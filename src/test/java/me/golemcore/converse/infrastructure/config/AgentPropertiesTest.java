package me.golemcore.converse.infrastructure.config;

import me.golemcore.converse.domain.model.ToolChoice;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentPropertiesTest {

    @Test
    void hasLoopDefaults() {
        AgentProperties properties = new AgentProperties();

        assertEquals(20, properties.getMaxSteps());
        assertEquals(2, properties.getDuplicateThreshold());
        assertEquals(ToolChoice.AUTO, properties.getToolChoice());
        assertEquals(List.of("terminate"), properties.getSpecialTools());
        assertEquals(Duration.ofSeconds(30), properties.getToolTimeout());
        assertFalse(properties.getConsole().isEnabled());
    }

    @Test
    void resolvesRegionalEndpoint() {
        AgentProperties.BedrockProperties bedrock = new AgentProperties.BedrockProperties();
        bedrock.setRegion("eu-west-1");

        assertEquals("https://bedrock-runtime.eu-west-1.amazonaws.com", bedrock.resolveEndpoint());
    }

    @Test
    void endpointOverrideWinsWithoutTrailingSlash() {
        AgentProperties.BedrockProperties bedrock = new AgentProperties.BedrockProperties();
        bedrock.setEndpoint("http://localhost:4566/");

        assertEquals("http://localhost:4566", bedrock.resolveEndpoint());
    }
}
