package czm.timebox_be.session;

import czm.timebox_be.engine.AssignmentStatus;
import czm.timebox_be.session.SessionDao.SessionRow;
import czm.timebox_be.web.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read access to scheduled sessions and the single user action on them: marking one completed.
 */
@Service
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    /** First start and last end of the non-conflicted sessions of one work item. */
    public record SessionWindow(OffsetDateTime start, OffsetDateTime end) {
    }

    private final SessionDao dao;

    public SessionService(SessionDao dao) {
        this.dao = dao;
    }

    public List<SessionResponse> list(Long workItemId) {
        List<SessionRow> rows = workItemId == null ? dao.listAll() : dao.listByWorkItem(workItemId);
        return rows.stream().map(SessionResponse::from).toList();
    }

    @Transactional
    public SessionResponse complete(long id) {
        SessionRow row = dao.findById(id)
                .orElseThrow(() -> ApiException.notFound("Naplánovaný blok nebyl nalezen.", "session"));
        if (row.status() != AssignmentStatus.SCHEDULED) {
            throw ApiException.conflict("Dokončit lze pouze naplánovaný blok.", "session_not_scheduled");
        }
        dao.updateStatus(id, AssignmentStatus.COMPLETED);
        log.info("Session completed id={} workItemId={}", id, row.workItemId());
        return dao.findById(id)
                .map(SessionResponse::from)
                .orElseThrow(() -> ApiException.internal("Blok byl dokončen, ale nepodařilo se načíst jeho data.", "session_reload_failed"));
    }

    /**
     * Derived start/end dates per work item. Conflicted sessions are ignored.
     */
    public Map<Long, SessionWindow> windowsByWorkItem() {
        Map<Long, SessionWindow> windows = new HashMap<>();
        for (SessionRow row : dao.listAll()) {
            if (row.status() == AssignmentStatus.CONFLICTED) {
                continue;
            }
            windows.merge(row.workItemId(), new SessionWindow(row.startTime(), row.endTime()), (a, b) -> new SessionWindow(
                    a.start().isBefore(b.start()) ? a.start() : b.start(),
                    a.end().isAfter(b.end()) ? a.end() : b.end()));
        }
        return windows;
    }
}
