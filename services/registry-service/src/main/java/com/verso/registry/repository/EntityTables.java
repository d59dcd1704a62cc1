package com.verso.registry.repository;

import com.verso.registry.domain.content.Content;
import com.verso.registry.domain.device.Device;
import com.verso.registry.domain.device.DeviceCount;
import com.verso.registry.domain.email.Email;
import com.verso.registry.domain.event.Event;
import com.verso.registry.domain.metric.Metric;
import com.verso.registry.domain.org.Organization;
import com.verso.registry.domain.token.Token;
import com.verso.registry.domain.user.User;

/**
 * Index layout of every entity kind. Each index row carries the kind's display text, so any index
 * can serve a text listing without loading bodies.
 */
public final class EntityTables {
    public static final String ALL = "all";
    public static final String TYPE = "type";
    public static final String AUTHOR = "author";
    public static final String EDITOR = "editor";
    public static final String TAG = "tag";
    public static final String EMAIL = "email";
    public static final String ORG = "org";
    public static final String ROLE = "role";
    public static final String STATUS = "status";
    public static final String ADDRESS = "address";
    public static final String USER = "user";
    public static final String DATE = "date";
    public static final String ENTITY = "entity";
    public static final String ENTITY_TYPE = "entity_type";
    public static final String LOG_LEVEL = "log_level";

    public static final EntityTable<Content> CONTENT = new EntityTable<>(
        "content",
        Content.class,
        IndexDefinition.single(TYPE, Content::typeName, Content::titleText),
        IndexDefinition.multi(AUTHOR, Content::authorNames, Content::titleText),
        IndexDefinition.single(EDITOR, Content::getEditorId, Content::titleText),
        IndexDefinition.multi(TAG, Content::getTags, Content::titleText),
        IndexDefinition.all(ALL, Content::titleText)
    );

    public static final EntityTable<User> USERS = new EntityTable<>(
        "user",
        User.class,
        IndexDefinition.single(EMAIL, user -> User.standardizeEmail(user.getEmail()), User::displayName),
        IndexDefinition.single(ORG, User::getOrgId, User::displayName),
        IndexDefinition.multi(ROLE, User::getRoles, User::displayName),
        IndexDefinition.single(STATUS, User::statusName, User::displayName),
        IndexDefinition.all(ALL, User::displayName)
    );

    public static final EntityTable<Organization> ORGANIZATIONS = new EntityTable<>(
        "organization",
        Organization.class,
        IndexDefinition.single(STATUS, Organization::statusName, Organization::getName),
        IndexDefinition.all(ALL, Organization::getName)
    );

    public static final EntityTable<Email> EMAILS = new EntityTable<>(
        "email",
        Email.class,
        IndexDefinition.multi(ADDRESS, Email::allAddresses, Email::getSubject),
        IndexDefinition.single(STATUS, Email::statusName, Email::getSubject),
        IndexDefinition.all(ALL, Email::getSubject)
    );

    public static final EntityTable<Device> DEVICES = new EntityTable<>(
        "device",
        Device.class,
        IndexDefinition.single(USER, Device::getUserId, Device::getUserAgent),
        IndexDefinition.single(DATE, Device::lastSeenOn, Device::getUserAgent),
        IndexDefinition.all(ALL, Device::getUserAgent)
    );

    public static final EntityTable<DeviceCount> DEVICE_COUNTS = new EntityTable<>(
        "device_count",
        DeviceCount.class,
        IndexDefinition.all(ALL, DeviceCount::getDate)
    );

    public static final EntityTable<Token> TOKENS = new EntityTable<>(
        "token",
        Token.class,
        IndexDefinition.single(USER, Token::getUserId, Token::getEmail),
        IndexDefinition.all(ALL, Token::getEmail)
    );

    public static final EntityTable<Metric> METRICS = new EntityTable<>(
        "metric",
        Metric.class,
        IndexDefinition.single(ENTITY, Metric::getEntityId, Metric::getTitle),
        IndexDefinition.single(ENTITY_TYPE, Metric::getEntityType, Metric::getTitle),
        IndexDefinition.multi(TAG, Metric::getTags, Metric::getTitle),
        IndexDefinition.all(ALL, Metric::getTitle)
    );

    public static final EntityTable<Event> EVENTS = new EntityTable<>(
        "event",
        Event.class,
        IndexDefinition.multi(ENTITY, Event::relatedIds, Event::getMessage),
        IndexDefinition.single(ENTITY_TYPE, Event::getEntityType, Event::getMessage),
        IndexDefinition.single(LOG_LEVEL, Event::logLevelName, Event::getMessage),
        IndexDefinition.single(DATE, Event::createdOn, Event::getMessage),
        IndexDefinition.all(ALL, Event::getMessage)
    );

    private EntityTables() {
    }
}
