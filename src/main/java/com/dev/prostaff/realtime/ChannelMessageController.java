package com.dev.prostaff.realtime;

import com.dev.prostaff.security.Identity;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

@Controller
public class ChannelMessageController {

    private final ChannelMessageService channelMessageService;

    public ChannelMessageController(ChannelMessageService channelMessageService) {
        this.channelMessageService = channelMessageService;
    }

    @MessageMapping("/channels/team/speak")
    public void speakToTeam(@Payload SpeakPayload payload, SimpMessageHeaderAccessor headers) {
        channelMessageService.send(headers.getSessionId(), identityOf(headers),
                ChannelRequest.team(), payload.content());
    }

    @MessageMapping("/channels/direct/speak")
    public void speakDirect(@Payload SpeakPayload payload, SimpMessageHeaderAccessor headers) {
        Identity identity = identityOf(headers);
        ChannelRequest request = ChannelRequest.direct(ChannelDestinations.parseRecipient(payload.recipientID()));
        channelMessageService.send(headers.getSessionId(), identity, request, payload.content());
    }

    @MessageExceptionHandler({ContentRejectedException.class, SubscriptionRejectedException.class})
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public ErrorPayload handleRejection(RuntimeException ex) {
        return new ErrorPayload(ex.getMessage());
    }

    private static Identity identityOf(SimpMessageHeaderAccessor headers) {
        return ConnectionAttributes.identityOf(headers.getSessionAttributes())
                .orElseThrow(() -> new SubscriptionRejectedException("Connection is not authenticated"));
    }
}
