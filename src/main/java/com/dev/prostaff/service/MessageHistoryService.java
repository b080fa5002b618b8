package com.dev.prostaff.service;

import com.dev.prostaff.realtime.ChannelMessageService;
import com.dev.prostaff.store.MessageRecord;
import com.dev.prostaff.store.MessageStore;
import com.dev.prostaff.store.UserStore;
import com.dev.prostaff.tenant.TenantContext;
import com.dev.prostaff.web.ForbiddenOperationException;
import com.dev.prostaff.web.ResourceNotFoundException;
import com.dev.prostaff.web.dto.MessageView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
public class MessageHistoryService {

    static final int PAGE_SIZE = 50;

    private final MessageStore messageStore;
    private final UserStore userStore;
    private final ChannelMessageService channelMessageService;
    private final Clock clock;

    public MessageHistoryService(MessageStore messageStore,
                                 UserStore userStore,
                                 ChannelMessageService channelMessageService,
                                 Clock clock) {
        this.messageStore = messageStore;
        this.userStore = userStore;
        this.channelMessageService = channelMessageService;
        this.clock = clock;
    }

    public List<MessageView> conversation(TenantContext tenant, UUID recipientId, OffsetDateTime before) {
        boolean recipientInTenant = userStore.findById(recipientId)
                .map(user -> user.belongsTo(tenant.organizationId()))
                .orElse(false);
        if (!recipientInTenant) {
            throw new ResourceNotFoundException("Recipient not found");
        }
        OffsetDateTime cursor = before != null ? before : OffsetDateTime.now(clock);
        List<MessageRecord> newestFirst = messageStore.findConversation(tenant, recipientId, cursor, PAGE_SIZE);
        List<MessageView> views = new ArrayList<>(newestFirst.size());
        for (MessageRecord record : newestFirst) {
            views.add(MessageView.of(record));
        }
        Collections.reverse(views);
        return views;
    }

    public void delete(TenantContext tenant, UUID messageId) {
        MessageRecord message = messageStore.findById(tenant, messageId)
                .filter(found -> !found.deleted())
                .orElseThrow(() -> new ResourceNotFoundException("Message not found"));
        if (!message.senderId().equals(tenant.userId()) && !tenant.role().isAdminOrOwner()) {
            throw new ForbiddenOperationException("Not allowed to delete this message");
        }
        MessageRecord deleted = messageStore.softDelete(tenant, messageId);
        log.info("Message {} deleted by user={}", messageId, tenant.userId());
        channelMessageService.broadcastDeletion(deleted);
    }
}
