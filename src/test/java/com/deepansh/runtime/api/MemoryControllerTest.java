package com.deepansh.runtime.api;

import com.deepansh.runtime.memory.ConversationMemory;
import com.deepansh.runtime.model.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class MemoryControllerTest {

    @Mock ConversationMemory memory;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new MemoryController(memory)).build();
    }

    @Test
    void getMemory_returnsTierSizesAndMessages() throws Exception {
        when(memory.getMessages()).thenReturn(List.of(
                Message.system("Historical context: greeted"), Message.user("weather?")));
        when(memory.longTermSize()).thenReturn(1);
        when(memory.shortTermSize()).thenReturn(1);

        mvc.perform(get("/api/v1/memory"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.longTermCount").value(1))
                .andExpect(jsonPath("$.shortTermCount").value(1))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("weather?"));
    }

    @Test
    void clear_returnsNoContent() throws Exception {
        mvc.perform(delete("/api/v1/memory")).andExpect(status().isNoContent());

        verify(memory).clear();
    }
}
