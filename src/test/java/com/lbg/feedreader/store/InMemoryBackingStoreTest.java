package com.lbg.feedreader.store;

class InMemoryBackingStoreTest extends BackingStoreContractTest {

    @Override
    protected BackingStore createStore() {
        return new InMemoryBackingStore();
    }
}
