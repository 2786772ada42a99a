package com.example.mediasync.session;

import java.util.Optional;

public interface PageElement {
    String text();

    Optional<PageElement> findChild(String selector);
}
