package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.domain.FailedIndexEntity;
import kaspi.lab.archiveService.dto.LedgerEntry;
import kaspi.lab.archiveService.repository.FailedIndexRepository;
import kaspi.lab.archiveService.service.FailedIndexLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcFailedIndexLedger implements FailedIndexLedger {

    private final FailedIndexRepository failedIndexRepository;

    @Override
    public Mono<Void> append(LedgerEntry entry) {
        FailedIndexEntity entity = FailedIndexEntity.builder()
                .fileId(entry.fileId())
                .reason(entry.reason())
                .timestamp(entry.timestamp())
                .build();

        return failedIndexRepository.save(entity)
                .doOnSuccess(saved -> log.info("Failed index recorded: fileId={}, ledgerId={}", entry.fileId(), saved.getId()))
                .then();
    }
}
