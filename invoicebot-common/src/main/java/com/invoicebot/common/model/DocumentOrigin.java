package com.invoicebot.common.model;

public enum DocumentOrigin {
    ATTACHMENT, // file attached to the message
    ARCHIVE_MEMBER, // unpacked from a ZIP attachment
    LINK_DOWNLOAD // fetched from a URL found in the message body
}
