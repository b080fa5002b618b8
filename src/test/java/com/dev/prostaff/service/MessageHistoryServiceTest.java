package com.dev.prostaff.service;

import com.dev.prostaff.domain.Role;
import com.dev.prostaff.realtime.ChannelMessageService;
import com.dev.prostaff.store.InMemoryUserStore;
import com.dev.prostaff.store.MessageRecord;
import com.dev.prostaff.store.MessageStore;
import com.dev.prostaff.store.UserRecord;
import com.dev.prostaff.tenant.TenantContext;
import com.dev.prostaff.web.ForbiddenOperationException;
import com.dev.prostaff.web.ResourceNotFoundException;
import com.dev.prostaff.web.dto.MessageView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("MessageHistoryService")
class MessageHistoryServiceTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final UUID orgId = UUID.randomUUID();
    private InMemoryUserStore userStore;
    private MessageStore messageStore;
    private ChannelMessageService channelMessageService;
    private MessageHistoryService service;
    private UserRecord alice;
    private UserRecord bob;

    @BeforeEach
    void setUp() {
        userStore = new InMemoryUserStore();
        messageStore = mock(MessageStore.class);
        channelMessageService = mock(ChannelMessageService.class);
        service = new MessageHistoryService(messageStore, userStore, channelMessageService,
                Clock.fixed(NOW, ZoneOffset.UTC));
        alice = userStore.add(orgId, Role.COACH);
        bob = userStore.add(orgId, Role.ANALYST);
    }

    private TenantContext tenantOf(UserRecord user) {
        return new TenantContext(user.organizationId(), user.id(), user.role());
    }

    private MessageRecord message(UserRecord sender, UUID recipientId, int minutesAgo) {
        return new MessageRecord(UUID.randomUUID(), "msg " + minutesAgo, sender.id(), sender.fullName(),
                sender.role(), recipientId, orgId, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(minutesAgo),
                false);
    }

    @Nested
    @DisplayName("Conversation")
    class Conversation {

        @Test
        @DisplayName("returns the page oldest first")
        void oldestFirst() {
            MessageRecord newest = message(bob, alice.id(), 1);
            MessageRecord oldest = message(alice, bob.id(), 5);
            TenantContext tenant = tenantOf(alice);
            OffsetDateTime now = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
            when(messageStore.findConversation(tenant, bob.id(), now, MessageHistoryService.PAGE_SIZE))
                    .thenReturn(List.of(newest, oldest));

            List<MessageView> views = service.conversation(tenant, bob.id(), null);

            assertThat(views).extracting(MessageView::id).containsExactly(oldest.id(), newest.id());
        }

        @Test
        @DisplayName("pages backwards from the given cursor")
        void usesCursor() {
            TenantContext tenant = tenantOf(alice);
            OffsetDateTime before = OffsetDateTime.parse("2026-02-01T00:00:00Z");
            when(messageStore.findConversation(tenant, bob.id(), before, MessageHistoryService.PAGE_SIZE))
                    .thenReturn(List.of());

            assertThat(service.conversation(tenant, bob.id(), before)).isEmpty();
            verify(messageStore).findConversation(tenant, bob.id(), before, MessageHistoryService.PAGE_SIZE);
        }

        @Test
        @DisplayName("a recipient of another organization looks missing")
        void foreignRecipient() {
            UserRecord stranger = userStore.add(UUID.randomUUID(), Role.OWNER);

            assertThatThrownBy(() -> service.conversation(tenantOf(alice), stranger.id(), null))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(messageStore);
        }
    }

    @Nested
    @DisplayName("Deletion")
    class Deletion {

        @Test
        @DisplayName("the sender may delete their message and subscribers are told")
        void senderDeletes() {
            MessageRecord record = message(alice, bob.id(), 1);
            TenantContext tenant = tenantOf(alice);
            when(messageStore.findById(tenant, record.id())).thenReturn(Optional.of(record));
            when(messageStore.softDelete(tenant, record.id())).thenReturn(record);

            service.delete(tenant, record.id());

            verify(messageStore).softDelete(tenant, record.id());
            verify(channelMessageService).broadcastDeletion(record);
        }

        @Test
        @DisplayName("an admin may delete someone else's message")
        void adminDeletes() {
            UserRecord admin = userStore.add(orgId, Role.ADMIN);
            MessageRecord record = message(alice, null, 1);
            TenantContext tenant = tenantOf(admin);
            when(messageStore.findById(tenant, record.id())).thenReturn(Optional.of(record));
            when(messageStore.softDelete(tenant, record.id())).thenReturn(record);

            service.delete(tenant, record.id());

            verify(messageStore).softDelete(tenant, record.id());
        }

        @Test
        @DisplayName("other members may not delete")
        void othersForbidden() {
            MessageRecord record = message(alice, bob.id(), 1);
            TenantContext tenant = tenantOf(bob);
            when(messageStore.findById(tenant, record.id())).thenReturn(Optional.of(record));

            assertThatThrownBy(() -> service.delete(tenant, record.id()))
                    .isInstanceOf(ForbiddenOperationException.class);
            verify(messageStore, never()).softDelete(any(), any());
            verifyNoInteractions(channelMessageService);
        }

        @Test
        @DisplayName("missing and already deleted messages are not found")
        void notFound() {
            TenantContext tenant = tenantOf(alice);
            MessageRecord gone = new MessageRecord(UUID.randomUUID(), "x", alice.id(), alice.fullName(),
                    alice.role(), null, orgId, OffsetDateTime.now(ZoneOffset.UTC), true);
            when(messageStore.findById(tenant, gone.id())).thenReturn(Optional.of(gone));
            UUID unknown = UUID.randomUUID();
            when(messageStore.findById(tenant, unknown)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.delete(tenant, gone.id())).isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> service.delete(tenant, unknown)).isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
