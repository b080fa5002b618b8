package com.dev.prostaff.web.rest;

import com.dev.prostaff.service.MessageHistoryService;
import com.dev.prostaff.tenant.TenantScope;
import com.dev.prostaff.web.dto.MessageView;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/messages")
public class MessageController {

    private final MessageHistoryService messageHistoryService;

    public MessageController(MessageHistoryService messageHistoryService) {
        this.messageHistoryService = messageHistoryService;
    }

    @GetMapping
    public List<MessageView> conversation(@RequestAttribute(TenantScope.REQUEST_ATTRIBUTE) TenantScope scope,
                                          @RequestParam UUID recipientId,
                                          @RequestParam(required = false)
                                          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime before) {
        return messageHistoryService.conversation(scope.context(), recipientId, before);
    }

    @DeleteMapping("/{messageId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@RequestAttribute(TenantScope.REQUEST_ATTRIBUTE) TenantScope scope,
                       @PathVariable UUID messageId) {
        messageHistoryService.delete(scope.context(), messageId);
    }
}
