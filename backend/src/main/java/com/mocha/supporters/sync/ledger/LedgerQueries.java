package com.mocha.supporters.sync.ledger;

final class LedgerQueries {
    static final String ACCOUNT_ORDERS = """
        query account($limit: Int, $offset: Int, $slug: String) {
          account(slug: $slug) {
            orders(limit: $limit, offset: $offset) {
              limit
              offset
              totalCount
              nodes {
                fromAccount {
                  id
                  name
                  slug
                  website
                  imgUrlMed: imageUrl(height:64)
                  imgUrlSmall: imageUrl(height:32)
                  type
                }
                totalDonations {
                  value
                }
                createdAt
              }
            }
          }
        }""";

    private LedgerQueries() {
    }
}
