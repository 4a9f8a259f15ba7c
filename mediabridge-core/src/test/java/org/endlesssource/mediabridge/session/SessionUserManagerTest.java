package org.endlesssource.mediabridge.session;

import org.endlesssource.mediabridge.remote.SessionEndpoints;
import org.endlesssource.mediabridge.test.RecordingRemoteSessionClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.endlesssource.mediabridge.test.RecordingRemoteSessionClient.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionUserManagerTest {
    private static final String HOST = "http://media.local";
    private final SessionEndpoints endpoints = new SessionEndpoints(HOST);

    private static final String USERS = "[{'Name':'Alice','Id':'u-alice'},{'Name':'bob','Id':'u-bob'}]";

    private SessionUserManager manager(RecordingRemoteSessionClient client) {
        return new SessionUserManager(client, endpoints, new SessionResolver(client, endpoints, "dev"));
    }

    @Test
    void parseUsernames_splitsAndTrims() {
        assertEquals(List.of("alice", "bob"), SessionUserManager.parseUsernames(" alice , ,bob "));
        assertEquals(List.of(), SessionUserManager.parseUsernames(""));
        assertEquals(List.of(), SessionUserManager.parseUsernames(null));
    }

    @Test
    void attachUsers_resolvesAttachesAndVerifies() {
        RecordingRemoteSessionClient client = new RecordingRemoteSessionClient();
        client.respond(endpoints.users(), USERS);
        client.respond(endpoints.sessionsByDevice("dev"), () -> {
            // session reflects the users attached so far
            boolean aliceAttached = client.postedUrls().contains(HOST + "/Sessions/S1/User/u-alice");
            return json(aliceAttached
                    ? "[{'Id':'S1','AdditionalUsers':[{'UserId':'u-alice'}]}]"
                    : "[{'Id':'S1','AdditionalUsers':[]}]");
        });

        List<UserAttachment> attachments = manager(client).attachUsernames("alice,BOB,carol");

        assertEquals(List.of(HOST + "/Sessions/S1/User/u-alice", HOST + "/Sessions/S1/User/u-bob"),
                client.postedUrls());
        assertEquals(List.of(
                new UserAttachment("alice", Optional.of("u-alice"), true),
                new UserAttachment("BOB", Optional.of("u-bob"), false),
                new UserAttachment("carol", Optional.empty(), false)), attachments);
        assertFalse(attachments.get(2).resolved());
    }

    @Test
    void attachUsers_withoutSession_doesNothing() {
        RecordingRemoteSessionClient client = new RecordingRemoteSessionClient()
                .respond(endpoints.users(), USERS)
                .respond(endpoints.sessionsByDevice("dev"), "[]");

        assertTrue(manager(client).attachUsers(List.of("alice")).isEmpty());
        assertTrue(client.posts().isEmpty());
    }

    @Test
    void resolveUserIds_isCaseInsensitive() {
        RecordingRemoteSessionClient client = new RecordingRemoteSessionClient().respond(endpoints.users(), USERS);

        assertEquals(Optional.of("u-alice"), manager(client).resolveUserIds(List.of("ALICE")).get("ALICE"));
    }

    @Test
    void resolveUserIds_userListUnavailable_leavesAllUnresolved() {
        RecordingRemoteSessionClient client = new RecordingRemoteSessionClient();

        assertEquals(Optional.empty(), manager(client).resolveUserIds(List.of("alice")).get("alice"));
    }
}
