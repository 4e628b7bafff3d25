package com.tidewatch.app.commands;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point for slash commands: {@code POST /commands} with
 * {@code {"text": "/cron run morning-brief", "sender": "alice"}}.
 */
@RestController
public class CommandEndpoint {

    public record CommandRequest(String text, String sender) {
    }

    private final CommandProcessor processor;

    public CommandEndpoint(CommandProcessor processor) {
        this.processor = processor;
    }

    @PostMapping("/commands")
    public ResponseEntity<CommandResult> handle(@RequestBody CommandRequest request) {
        CommandResult result = processor.handleCommand(request.text(), request.sender());
        if (result == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(CommandResult.error("Unknown command. Available: /"
                            + String.join(", /", processor.commandNames())));
        }
        return ResponseEntity.ok(result);
    }
}
