package com.gnovoa.matchfeed.api;

import com.gnovoa.matchfeed.api.dto.MatchViewersResponse;
import com.gnovoa.matchfeed.ws.MatchHub;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/matches")
public class MatchViewersController {

    private final MatchHub hub;

    public MatchViewersController(MatchHub hub) {
        this.hub = hub;
    }

    @GetMapping("/{matchId}/viewers")
    public ResponseEntity<MatchViewersResponse> viewers(@PathVariable long matchId) {
        if (matchId <= 0) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(new MatchViewersResponse(matchId, hub.connectionCount(matchId)));
    }
}
