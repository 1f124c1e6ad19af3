package quest.gekko.salesboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import quest.gekko.salesboard.dto.LeaderboardRowView;
import quest.gekko.salesboard.dto.SnapshotView;
import quest.gekko.salesboard.service.core.LeaderboardService;
import quest.gekko.salesboard.web.dto.Requests;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class LeaderboardController {
    private final LeaderboardService leaderboardService;

    @PostMapping("/periods/{periodId}/leaderboard/snapshots")
    @ResponseStatus(HttpStatus.CREATED)
    public SnapshotView computeSnapshot(@PathVariable Long periodId,
                                        @RequestBody(required = false) Requests.ComputeSnapshot body) {
        return leaderboardService.computeSnapshot(periodId, body == null ? null : body.rulesVersion());
    }

    @GetMapping("/periods/{periodId}/leaderboard")
    public List<SnapshotView> snapshots(@PathVariable Long periodId) {
        return leaderboardService.listSnapshots(periodId);
    }

    @GetMapping("/periods/{periodId}/leaderboard/current")
    public List<LeaderboardRowView> current(@PathVariable Long periodId) {
        return leaderboardService.currentRows(periodId);
    }

    @GetMapping("/leaderboard/snapshots/{snapshotId}")
    public List<LeaderboardRowView> rows(@PathVariable Long snapshotId) {
        return leaderboardService.getRows(snapshotId);
    }
}
