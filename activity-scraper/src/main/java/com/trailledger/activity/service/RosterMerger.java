package com.trailledger.activity.service;

import com.trailledger.activity.model.Participation;
import com.trailledger.activity.model.Person;
import com.trailledger.activity.model.RosterEntry;
import com.trailledger.activity.source.ParticipantSnapshot;
import com.trailledger.activity.store.ParticipationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aligns the stored roster of one activity with a freshly scraped one.
 *
 * Participants present in both are updated in place, new ones are added
 * (creating stub people where needed) and stored participants missing from
 * the scrape are removed. The result depends only on the scraped roster, so
 * applying the same roster twice changes nothing the second time.
 *
 * Not transactional on its own; callers run it inside
 * {@link ParticipationStore#inTransaction}.
 */
@Slf4j
@RequiredArgsConstructor
public class RosterMerger {

    private final ParticipationStore store;

    public MergeStats merge(String activityUrl, List<ParticipantSnapshot> scraped) {
        Map<String, Participation> current = new LinkedHashMap<>();
        for (RosterEntry entry : store.listRoster(activityUrl)) {
            current.put(entry.person().getProfileUrl(), entry.participation());
        }
        Set<String> unseen = new LinkedHashSet<>(current.keySet());

        int created = 0;
        int updated = 0;
        int stubs = 0;

        for (ParticipantSnapshot participant : scraped) {
            if (ensurePerson(participant)) {
                stubs++;
            }

            Participation existing = current.get(participant.profileUrl());
            if (existing != null) {
                apply(existing, participant);
                store.updateParticipation(existing);
                unseen.remove(participant.profileUrl());
                updated++;
                log.debug("  Updated {}", participant.fullName());
            } else {
                Participation added = Participation.builder()
                        .profileUrl(participant.profileUrl())
                        .activityUrl(activityUrl)
                        .build();
                apply(added, participant);
                store.createParticipation(added);
                current.put(participant.profileUrl(), added);
                created++;
                log.debug("  Added {}", participant.fullName());
            }
        }

        for (String profileUrl : unseen) {
            store.removeParticipation(profileUrl, activityUrl);
            log.debug("  Removed {}", profileUrl);
        }

        MergeStats stats = new MergeStats(created, updated, unseen.size(), stubs);
        log.info("  Roster {}: {} added, {} updated, {} removed", activityUrl,
                stats.created(), stats.updated(), stats.removed());
        return stats;
    }

    /** @return true when a stub person had to be created */
    private boolean ensurePerson(ParticipantSnapshot participant) {
        if (store.findPersonByUrl(participant.profileUrl()).isPresent()) {
            return false;
        }
        store.createPerson(Person.stub(participant.profileUrl(), participant.fullName()));
        return true;
    }

    private static void apply(Participation target, ParticipantSnapshot source) {
        target.setRole(source.role());
        target.setCanceled(source.canceled());
        target.setRegistration(source.registration());
        target.setMemberResult(source.memberResult());
    }
}
