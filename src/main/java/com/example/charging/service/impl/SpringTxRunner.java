package com.example.charging.service.impl;

import com.example.charging.service.TxRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

@Component
public class SpringTxRunner implements TxRunner {

    private final TransactionTemplate template;

    public SpringTxRunner(PlatformTransactionManager tm) {
        this.template = new TransactionTemplate(tm);
        this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    }

    @Override
    public <T> T required(Supplier<T> body) {
        return template.execute(status -> body.get());
    }
}
