package ru.aritmos.flowanalyzer.types;

import ru.aritmos.flowanalyzer.syntax.FlowSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Реестр событий-триггеров и встроенные объявления их типов.
 * <p>
 * Объявления хранятся как TypeScript-текст и разбираются тем же парсером, что и код flow:
 * так разрешение типов работает одинаково для пользовательских и встроенных интерфейсов.
 * Встроенные типы считаются закрытыми (без индексной сигнатуры), иначе обращение к необъявленному
 * полю payload невозможно было бы обнаружить.
 */
public final class TriggerEvents {

    /** Интерфейс-реестр: ключ события → тип события. */
    public static final String REGISTRY_TYPE = "BubbleTriggerEventRegistry";

    /** Общая база всех событий. */
    public static final String BASE_EVENT_TYPE = "BubbleTriggerEvent";

    private static final Map<String, String> EVENT_TYPES = new LinkedHashMap<>();

    static {
        EVENT_TYPES.put("slack/bot_mentioned", "SlackMentionEvent");
        EVENT_TYPES.put("slack/message_received", "SlackMessageReceivedEvent");
        EVENT_TYPES.put("schedule/cron", "CronEvent");
        EVENT_TYPES.put("webhook/http", "WebhookEvent");
    }

    private static final String DECLARATIONS = """
            interface BubbleTriggerEventRegistry {
              'slack/bot_mentioned': SlackMentionEvent;
              'slack/message_received': SlackMessageReceivedEvent;
              'schedule/cron': CronEvent;
              'webhook/http': WebhookEvent;
            }

            interface BubbleTriggerEvent {
              type: keyof BubbleTriggerEventRegistry;
              timestamp: string;
              executionId: string;
              path: string;
            }

            interface CronEvent extends BubbleTriggerEvent {
              /** The cron expression defining when this event triggers */
              cron: string;
              body?: Record<string, unknown>;
            }

            interface WebhookEvent extends BubbleTriggerEvent {
              body?: Record<string, unknown>;
            }

            interface SlackEventWrapper {
              token: string;
              team_id: string;
              api_app_id: string;
              event: SlackAppMentionEvent | SlackMessageEvent;
              type: 'event_callback';
              authorizations: Array<{
                enterprise_id?: string;
                team_id: string;
                user_id: string;
                is_bot: boolean;
              }>;
              event_context: string;
              event_id: string;
              event_time: number;
            }

            interface SlackAppMentionEvent {
              type: 'app_mention';
              user: string;
              text: string;
              ts: string;
              channel: string;
              event_ts: string;
              thread_ts?: string;
            }

            interface SlackMessageEvent {
              type: 'message';
              user: string;
              text: string;
              ts: string;
              channel: string;
              event_ts: string;
              channel_type: 'channel' | 'group' | 'im' | 'mpim';
              subtype?: string;
              bot_id?: string;
              bot_profile?: {
                id: string;
                name: string;
                app_id: string;
              };
            }

            interface SlackMentionEvent extends BubbleTriggerEvent {
              slack_event: SlackEventWrapper;
              channel: string;
              user: string;
              text: string;
              thread_ts?: string;
            }

            interface SlackMessageReceivedEvent extends BubbleTriggerEvent {
              slack_event: SlackEventWrapper;
              channel: string;
              user: string;
              text: string;
              channel_type: 'channel' | 'group' | 'im' | 'mpim';
              subtype?: string;
            }
            """;

    private static final FlowSource BUILTIN_SOURCE = FlowSource.parse(DECLARATIONS);

    private TriggerEvents() {
        // утилитарный класс
    }

    public static boolean isKnown(String eventKey) {
        return eventKey != null && EVENT_TYPES.containsKey(eventKey);
    }

    /**
     * Имя интерфейса события для ключа или {@code null}.
     */
    public static String eventTypeName(String eventKey) {
        return eventKey == null ? null : EVENT_TYPES.get(eventKey);
    }

    public static List<String> keys() {
        return List.copyOf(EVENT_TYPES.keySet());
    }

    /**
     * Разобранные встроенные объявления.
     */
    public static FlowSource builtinSource() {
        return BUILTIN_SOURCE;
    }
}
