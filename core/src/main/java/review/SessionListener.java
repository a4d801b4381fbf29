package review;

/**
 * Получает снимок после каждого изменения состояния любой сессии.
 * Вызывается в потоке, выполнившем изменение; реализации не должны блокироваться.
 */
@FunctionalInterface
public interface SessionListener {

    void onSessionUpdate(SessionSnapshot snapshot);
}
