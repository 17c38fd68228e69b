package org.morkdb.filters;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converters by row namespace and column name.
 *
 * {@link #defaults()} knows the fields of Thunderbird address books, mail
 * summary files and folder caches, and of Firefox history. Namespaces are
 * the resolved row scopes, e.g. "ns:msg:db:row:scope:msgs:all". Note that
 * "ns:msg" is shared by summary files and folder caches; folder caches use
 * the "folders" scope, which summary files never do.
 */
public final class FieldConverterRegistry {

    // Shared converters

    private static final FieldConverter BOOL = EnumerationConverter.bool();
    private static final FieldConverter MESSAGE_FLAGS = new MessageFlagsConverter();
    private static final FieldConverter PURGE_TIME = new FormattedTimeConverter(FormattedTimeConverter.CTIME_PATTERN);

    // nsMsgFolderFlags.idl
    private static final FieldConverter FOLDER_FLAGS = new FlagsConverter("",
            "Newsgroup", "NewsHost", "Mail", "Directory", "Elided", "Virtual",
            "Subscribed", "Unused2", "Trash", "SentMail", "Drafts", "Queue",
            "Inbox", "ImapBox", "Archive", "ProfileGroup", "Unused4", "GotNew",
            "ImapServer", "ImapPersonal", "ImapPublic", "ImapOtherUser",
            "Templates", "PersonalShared", "ImapNoselect", "CreatedOffline",
            "ImapNoinferiors", "Offline", "OfflineEvents", "CheckNew", "Junk",
            "Favorite");

    private final Map<String, Map<String, FieldConverter>> converters = new HashMap<>();

    /**
     * Registers a converter, replacing any converter for the same field.
     *
     * @return this registry for chaining
     */
    public FieldConverterRegistry register(String namespace, String column, FieldConverter converter) {
        converters.computeIfAbsent(namespace, ns -> new HashMap<>()).put(column, converter);
        return this;
    }

    public Optional<FieldConverter> converterFor(String namespace, String column) {
        return Optional.ofNullable(convertersFor(namespace).get(column));
    }

    /**
     * @return Read-only column-to-converter map; empty for unknown namespaces
     */
    public Map<String, FieldConverter> convertersFor(String namespace) {
        Map<String, FieldConverter> byColumn = converters.get(namespace);
        return byColumn == null ? Map.of() : Collections.unmodifiableMap(byColumn);
    }

    /**
     * Creates a registry with the known Thunderbird and Firefox fields.
     */
    public static FieldConverterRegistry defaults() {
        FieldConverterRegistry registry = new FieldConverterRegistry();
        registerAddressBook(registry);
        registerHistory(registry);
        registerFolderCache(registry);
        registerFolderInfo(registry);
        registerMessages(registry);
        registerThreadMetaRows(registry);
        return registry;
    }

    private static void registerAddressBook(FieldConverterRegistry registry) {
        String card = "ns:addrbk:db:row:scope:card:all";
        registry.register(card, "AllowRemoteContent", BOOL)
                .register(card, "CardType",
                        EnumerationConverter.withDefault("normal", "normal", "AOL groups", "AOL additional email"))
                .register(card, "LastModifiedDate", SecondsConverter.HEX_SECONDS)
                .register(card, "PopularityIndex", IntConverter.HEX)
                .register(card, "PreferMailFormat", EnumerationConverter.of("unknown", "plaintext", "html"));

        registry.register("ns:addrbk:db:row:scope:list:all", "ListTotalAddresses", IntConverter.HEX);
    }

    private static void registerHistory(FieldConverterRegistry registry) {
        String history = "ns:history:db:row:scope:history:all";
        registry.register(history, "FirstVisitDate", SecondsConverter.MICROSECONDS)
                .register(history, "LastVisitDate", SecondsConverter.MICROSECONDS)
                .register(history, "Hidden", new PresenceConverter())
                .register(history, "Typed", new PresenceConverter());
    }

    private static void registerFolderCache(FieldConverterRegistry registry) {
        String folders = "ns:msg:db:row:scope:folders:all";
        registry.register(folders, "LastPurgeTime", PURGE_TIME)
                .register(folders, "MRUTime", SecondsConverter.SECONDS)
                .register(folders, "aclFlags", new FlagsConverter("",
                        "IMAP_ACL_READ_FLAG", "IMAP_ACL_STORE_SEEN_FLAG",
                        "IMAP_ACL_WRITE_FLAG", "IMAP_ACL_INSERT_FLAG",
                        "IMAP_ACL_POST_FLAG", "IMAP_ACL_CREATE_SUBFOLDER_FLAG",
                        "IMAP_ACL_DELETE_FLAG", "IMAP_ACL_ADMINISTER_FLAG",
                        "IMAP_ACL_RETRIEVED_FLAG", "IMAP_ACL_EXPUNGE_FLAG",
                        "IMAP_ACL_DELETE_FOLDER"))
                .register(folders, "boxFlags", new FlagsConverter("kNoFlags",
                        "kMarked", "kUnmarked", "kNoinferiors", "kNoselect",
                        "kImapTrash", "kJustExpunged", "kPersonalMailbox",
                        "kPublicMailbox", "kOtherUsersMailbox", "kNameSpace",
                        "kNewlyCreatedFolder", "kImapDrafts", "kImapSpam",
                        "kImapSent", "kImapInbox", "kImapAllMail",
                        "kImapXListTrash"))
                .register(folders, "hierDelim", new HierarchyDelimiterConverter())
                .register(folders, "flags", FOLDER_FLAGS)
                .register(folders, "totalMsgs", IntConverter.SIGNED_HEX32)
                .register(folders, "totalUnreadMsgs", IntConverter.SIGNED_HEX32)
                .register(folders, "pendingUnreadMsgs", IntConverter.SIGNED_HEX32)
                .register(folders, "pendingMsgs", IntConverter.SIGNED_HEX32)
                .register(folders, "expungedBytes", IntConverter.HEX)
                .register(folders, "folderSize", IntConverter.HEX);
    }

    private static void registerFolderInfo(FieldConverterRegistry registry) {
        String info = "ns:msg:db:row:scope:dbfolderinfo:all";
        registry.register(info, "current-view", EnumerationConverter.of(
                        "kViewItemAll", "kViewItemUnread", "kViewItemTags",
                        "kViewItemNotDeleted", null, null, null, "kViewItemVirtual",
                        "kViewItemCustomize", "kViewItemFirstCustom"))
                .register(info, "retainBy", EnumerationConverter.of(
                        null, "nsMsgRetainAll", "nsMsgRetainByAge", "nsMsgRetainByNumHeaders"))
                .register(info, "daysToKeepHdrs", IntConverter.HEX)
                .register(info, "numHdrsToKeep", IntConverter.HEX)
                .register(info, "daysToKeepBodies", IntConverter.HEX)
                .register(info, "keepUnreadOnly", BOOL)
                .register(info, "useServerDefaults", BOOL)
                .register(info, "cleanupBodies", BOOL)
                .register(info, "LastPurgeTime", PURGE_TIME)
                .register(info, "MRUTime", SecondsConverter.SECONDS)
                .register(info, "expungedBytes", IntConverter.HEX)
                .register(info, "flags", FOLDER_FLAGS)
                .register(info, "folderSize", IntConverter.HEX)
                .register(info, "numMsgs", IntConverter.HEX)
                .register(info, "numNewMsgs", IntConverter.HEX)
                .register(info, "folderDate", SecondsConverter.HEX_SECONDS)
                .register(info, "charSetOverride", BOOL)
                .register(info, "viewType", EnumerationConverter.of(
                        "eShowAllThreads", null, "eShowThreadsWithUnread",
                        "eShowWatchedThreadsWithUnread", "eShowQuickSearchResults",
                        "eShowVirtualFolderResults", "eShowSearch"))
                .register(info, "viewFlags", new FlagsConverter("kNone",
                        "kThreadedDisplay", null, null, "kShowIgnored",
                        "kUnreadOnly", "kExpandAll", "kGroupBySort"))
                .register(info, "sortType", new EnumerationConverter(SortColumnsConverter.SORT_TYPES, null, 16))
                .register(info, "sortOrder", EnumerationConverter.of("none", "ascending", "descending"))
                .register(info, "fixedBadRefThreading", BOOL)
                .register(info, "imapFlags", new ImapFlagsConverter())
                .register(info, "sortColumns", new SortColumnsConverter());
    }

    private static void registerMessages(FieldConverterRegistry registry) {
        String msgs = "ns:msg:db:row:scope:msgs:all";
        registry.register(msgs, "ProtoThreadFlags", MESSAGE_FLAGS)
                .register(msgs, "date", SecondsConverter.HEX_SECONDS)
                .register(msgs, "size", IntConverter.HEX)
                .register(msgs, "flags", MESSAGE_FLAGS)
                .register(msgs, "priority", EnumerationConverter.of(
                        MessageFlagsConverter.PRIORITY_LABELS.toArray(new String[0])))
                .register(msgs, "label", IntConverter.HEX)
                .register(msgs, "statusOfset", IntConverter.HEX)
                .register(msgs, "numLines", IntConverter.HEX)
                .register(msgs, "msgOffset", IntConverter.HEX)
                .register(msgs, "offlineMsgSize", IntConverter.HEX)
                .register(msgs, "numRefs", IntConverter.HEX)
                .register(msgs, "dateReceived", SecondsConverter.HEX_SECONDS)
                .register(msgs, "remoteContentPolicy", EnumerationConverter.of(
                        "kNoRemoteContentPolicy", "kBlockRemoteContent", "kAllowRemoteContent"));
    }

    // Thread meta-rows of summary files live in the literal scope "m"
    private static void registerThreadMetaRows(FieldConverterRegistry registry) {
        registry.register("m", "children", IntConverter.HEX)
                .register("m", "unreadChildren", IntConverter.HEX)
                .register("m", "threadFlags", MESSAGE_FLAGS)
                .register("m", "threadNewestMsgDate", SecondsConverter.HEX_SECONDS);
    }
}
