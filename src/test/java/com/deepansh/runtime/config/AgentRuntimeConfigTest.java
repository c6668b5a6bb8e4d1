package com.deepansh.runtime.config;

import com.deepansh.runtime.tool.AgentTool;
import com.deepansh.runtime.tool.impl.CalculatorTool;
import com.deepansh.runtime.tool.impl.EchoTool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentRuntimeConfigTest {

    private final List<AgentTool<?>> registered = List.of(new EchoTool(), new CalculatorTool());

    private static AgentProperties.AgentDefinition definition(String... tools) {
        AgentProperties.AgentDefinition definition = new AgentProperties.AgentDefinition();
        definition.setName("assistant");
        definition.setTools(List.of(tools));
        return definition;
    }

    @Test
    void selectTools_noToolList_getsEveryTool() {
        assertThat(AgentRuntimeConfig.selectTools(definition(), registered))
                .extracting(AgentTool::getName)
                .containsExactly("echo", "calculator");
    }

    @Test
    void selectTools_namedTools_onlyThose() {
        assertThat(AgentRuntimeConfig.selectTools(definition("calculator"), registered))
                .extracting(AgentTool::getName)
                .containsExactly("calculator");
    }

    @Test
    void selectTools_unknownName_isSkipped() {
        assertThat(AgentRuntimeConfig.selectTools(definition("echo", "teleport"), registered))
                .extracting(AgentTool::getName)
                .containsExactly("echo");
    }
}
