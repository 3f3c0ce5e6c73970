package com.livedesk.relay.chat.api;

import com.livedesk.relay.chat.room.RoomStore;
import com.livedesk.relay.chat.ws.WsSessionRegistry;
import com.livedesk.relay.common.api.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class StatusController {

    public record StatusResponse(int waiting, int active, int pending, int connections, int admins) {
    }

    private final RoomStore roomStore;
    private final WsSessionRegistry sessionRegistry;

    public StatusController(RoomStore roomStore, WsSessionRegistry sessionRegistry) {
        this.roomStore = roomStore;
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping("/status")
    public ApiResponse<StatusResponse> status() {
        var stats = roomStore.stats();
        return ApiResponse.ok(new StatusResponse(
                stats.waiting(),
                stats.active(),
                stats.pending(),
                sessionRegistry.size(),
                sessionRegistry.adminConnectionIds().size()
        ));
    }
}
