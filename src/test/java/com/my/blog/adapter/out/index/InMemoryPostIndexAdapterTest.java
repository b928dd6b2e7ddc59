package com.my.blog.adapter.out.index;

import com.my.blog.domain.port.out.PostIndexPort;

class InMemoryPostIndexAdapterTest extends PostIndexContractTest {

    @Override
    protected PostIndexPort createIndex() {
        return new InMemoryPostIndexAdapter();
    }
}
