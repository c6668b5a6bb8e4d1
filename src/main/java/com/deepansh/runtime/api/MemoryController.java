package com.deepansh.runtime.api;

import com.deepansh.runtime.memory.ConversationMemory;
import com.deepansh.runtime.model.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final ConversationMemory memory;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getMemory() {
        List<Message> messages = memory.getMessages();
        return ResponseEntity.ok(Map.of(
                "longTermCount", memory.longTermSize(),
                "shortTermCount", memory.shortTermSize(),
                "messages", messages));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        log.info("Clearing conversation memory");
        memory.clear();
        return ResponseEntity.noContent().build();
    }
}
