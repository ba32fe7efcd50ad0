package org.whiteelephant.service.play.stream;

import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * LISTEN PostgreSQL sur une connexion dédiée. Le trigger {@code notify_play_event}
 * publie chaque ligne insérée dans play_events sur ce canal, pour toutes les instances.
 */
@Slf4j
public class PgNotificationSourceFactory implements PlayNotificationSourceFactory {

    private static final Pattern CHANNEL_NAME = Pattern.compile("[a-z_][a-z0-9_]*");

    private final DataSource dataSource;
    private final String channel;

    public PgNotificationSourceFactory(DataSource dataSource, String channel) {
        if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: " + channel);
        }
        this.dataSource = dataSource;
        this.channel = channel;
    }

    @Override
    public PlayNotificationSource open() throws NotificationChannelException {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(true);
            PGConnection pg = conn.unwrap(PGConnection.class);
            try (Statement st = conn.createStatement()) {
                st.execute("LISTEN " + channel);
            }
            return new PgSource(conn, pg);
        } catch (SQLException e) {
            if (conn != null) {
                try {
                    conn.close();
                } catch (SQLException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw new NotificationChannelException("Cannot LISTEN on channel '" + channel + "'", e);
        }
    }

    @Override
    public String describe() {
        return "postgres channel '" + channel + "'";
    }

    private final class PgSource implements PlayNotificationSource {
        private final Connection conn;
        private final PGConnection pg;

        PgSource(Connection conn, PGConnection pg) {
            this.conn = conn;
            this.pg = pg;
        }

        @Override
        public List<String> poll(Duration timeout) throws NotificationChannelException {
            try {
                // 0 = attente infinie côté driver, on garde toujours un délai borné
                int millis = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
                PGNotification[] notifications = pg.getNotifications(millis);
                if (notifications == null || notifications.length == 0) return List.of();
                List<String> payloads = new ArrayList<>(notifications.length);
                for (PGNotification n : notifications) {
                    if (channel.equals(n.getName())) payloads.add(n.getParameter());
                }
                return payloads;
            } catch (SQLException e) {
                throw new NotificationChannelException("Notification channel '" + channel + "' lost", e);
            }
        }

        @Override
        public void close() {
            try {
                conn.close();
            } catch (SQLException e) {
                log.warn("Error closing listener connection for channel '{}': {}", channel, e.getMessage());
            }
        }
    }
}
