package org.crash.controller;

import lombok.RequiredArgsConstructor;
import org.crash.config.CrashSettings;
import org.crash.service.crash.broadcast.GameBroadcaster;
import org.crash.service.crash.engine.EngineClock;
import org.crash.service.crash.fair.CrashPointGenerator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/crash")
@RequiredArgsConstructor
public class CrashController {

    private final EngineClock clock;
    private final CrashSettings settings;

    // état courant du moteur (jamais la graine, seulement son hash)
    @GetMapping("/state")
    public ResponseEntity<?> state() {
        EngineClock.Snapshot s = clock.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roundId", s.roundId);
        body.put("phase", s.phase != null ? s.phase.name() : null);
        body.put("multiplier", GameBroadcaster.formatMultiplier(s.multiplier));
        body.put("time", s.elapsedSeconds);
        body.put("seedHash", s.seedHash);
        return ResponseEntity.ok(body);
    }

    // recalcul d'un crash point à partir d'une graine révélée
    @GetMapping("/verify")
    public ResponseEntity<?> verify(@RequestParam String serverSeed,
                                    @RequestParam(required = false) String clientSeed,
                                    @RequestParam long nonce) {
        if (serverSeed.isBlank() || nonce < 0)
            return ResponseEntity.badRequest().body(Map.of("error", "Paramètres invalides"));
        String cs = (clientSeed == null || clientSeed.isBlank()) ? settings.getClientSeed() : clientSeed;
        String roundHash = CrashPointGenerator.roundHash(serverSeed, cs, nonce);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("clientSeed", cs);
        body.put("nonce", nonce);
        body.put("roundHash", roundHash);
        body.put("crashPoint", CrashPointGenerator.crashPointFromHash(roundHash).toPlainString());
        return ResponseEntity.ok(body);
    }
}
